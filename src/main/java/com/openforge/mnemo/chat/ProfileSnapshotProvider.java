package com.openforge.mnemo.chat;

import java.util.Optional;

/**
 * Source of user profile snapshots. Profile management lives outside this
 * service; register a bean of this type to feed it into chat turns.
 */
@FunctionalInterface
public interface ProfileSnapshotProvider {

    Optional<ProfileSnapshot> snapshotFor(String userId);
}
