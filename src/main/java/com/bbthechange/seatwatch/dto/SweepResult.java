package com.bbthechange.seatwatch.dto;

/**
 * Result object for one sweep over all tracked sections.
 * Contains statistics about the sweep.
 */
public class SweepResult {

    private int usersScanned;
    private int itemsPolled;
    private int itemsUpdated;
    private int itemsNotMatched;
    private int itemsFailed;
    private int notificationsSent;
    private long durationMs;

    // Default constructor
    public SweepResult() {
    }

    private SweepResult(int usersScanned, int itemsPolled, int itemsUpdated, int itemsNotMatched,
                        int itemsFailed, int notificationsSent, long durationMs) {
        this.usersScanned = usersScanned;
        this.itemsPolled = itemsPolled;
        this.itemsUpdated = itemsUpdated;
        this.itemsNotMatched = itemsNotMatched;
        this.itemsFailed = itemsFailed;
        this.notificationsSent = notificationsSent;
        this.durationMs = durationMs;
    }

    public static SweepResult completed(int usersScanned, int itemsPolled, int itemsUpdated, int itemsNotMatched,
                                        int itemsFailed, int notificationsSent, long durationMs) {
        return new SweepResult(usersScanned, itemsPolled, itemsUpdated, itemsNotMatched,
                itemsFailed, notificationsSent, durationMs);
    }

    /**
     * Create a SweepResult for when nothing is tracked (skip scenario).
     */
    public static SweepResult nothingTracked(long durationMs) {
        return new SweepResult(0, 0, 0, 0, 0, 0, durationMs);
    }

    public int getUsersScanned() {
        return usersScanned;
    }

    public void setUsersScanned(int usersScanned) {
        this.usersScanned = usersScanned;
    }

    public int getItemsPolled() {
        return itemsPolled;
    }

    public void setItemsPolled(int itemsPolled) {
        this.itemsPolled = itemsPolled;
    }

    public int getItemsUpdated() {
        return itemsUpdated;
    }

    public void setItemsUpdated(int itemsUpdated) {
        this.itemsUpdated = itemsUpdated;
    }

    public int getItemsNotMatched() {
        return itemsNotMatched;
    }

    public void setItemsNotMatched(int itemsNotMatched) {
        this.itemsNotMatched = itemsNotMatched;
    }

    public int getItemsFailed() {
        return itemsFailed;
    }

    public void setItemsFailed(int itemsFailed) {
        this.itemsFailed = itemsFailed;
    }

    public int getNotificationsSent() {
        return notificationsSent;
    }

    public void setNotificationsSent(int notificationsSent) {
        this.notificationsSent = notificationsSent;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    @Override
    public String toString() {
        return "SweepResult{" +
                "usersScanned=" + usersScanned +
                ", itemsPolled=" + itemsPolled +
                ", itemsUpdated=" + itemsUpdated +
                ", itemsNotMatched=" + itemsNotMatched +
                ", itemsFailed=" + itemsFailed +
                ", notificationsSent=" + notificationsSent +
                ", durationMs=" + durationMs +
                '}';
    }
}
