package com.crewdesk.launcher;

/**
 * A file that appeared or changed in a task directory.
 *
 * @param path   path relative to the task directory, '/'-separated
 * @param change "created" or "modified"
 */
public record FileChange(String path, String change) {}
