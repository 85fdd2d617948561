package com.crewdesk.core.engine;

/**
 * Returned to the submitter once a task is persisted and queued.
 *
 * @param position 0 if the task became active, otherwise its place in the waiting list
 */
public record SubmitReceipt(String id, String text, int position, long createdAt) {
}
