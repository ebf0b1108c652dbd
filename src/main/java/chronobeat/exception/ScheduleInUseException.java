package chronobeat.exception;

/**
 * Delete of an interval or crontab that periodic tasks still reference.
 */
public class ScheduleInUseException extends SchedulerException {

    private final String scheduleType;
    private final long scheduleId;
    private final int referencingTasks;

    public ScheduleInUseException(String scheduleType, long scheduleId, int referencingTasks) {
        super(ErrorCode.SCHEDULE_IN_USE,
                String.format("%s %d is used by %d periodic task(s)", scheduleType, scheduleId, referencingTasks));
        this.scheduleType = scheduleType;
        this.scheduleId = scheduleId;
        this.referencingTasks = referencingTasks;
    }

    public String scheduleType() {
        return scheduleType;
    }

    public long scheduleId() {
        return scheduleId;
    }

    public int referencingTasks() {
        return referencingTasks;
    }
}
