package io.callroster.core.update;

/**
 * Unit of the server push stream for one call:
 *  - StateUpdate:        versioned roster delta.
 *  - CallSettingsUpdate: unversioned call-level settings change.
 */
public sealed interface Update permits StateUpdate, CallSettingsUpdate {}
