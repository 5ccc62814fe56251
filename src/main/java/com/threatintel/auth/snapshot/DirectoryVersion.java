package com.threatintel.auth.snapshot;

/**
 * Version stamp of the directory as reported by a backend.
 *
 * @param version   monotonically increasing version number
 * @param timestamp seconds since the epoch at which the directory reached this version
 */
public record DirectoryVersion(long version, double timestamp) {
}
