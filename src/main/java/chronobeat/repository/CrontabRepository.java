package chronobeat.repository;

import chronobeat.model.CrontabSchedule;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for crontab schedules.
 * Every mutation bumps the change marker in the same transaction.
 */
public interface CrontabRepository {

    /**
     * Insert a new crontab. The id of the argument is ignored.
     *
     * @return the stored crontab with its generated id
     */
    CrontabSchedule create(CrontabSchedule crontab);

    Optional<CrontabSchedule> findById(long id);

    List<CrontabSchedule> findAll();

    /**
     * @return true if the row existed
     */
    boolean update(CrontabSchedule crontab);

    /**
     * @return true if deleted, false if not found
     * @throws chronobeat.exception.ScheduleInUseException if any periodic task
     *                                                     references it
     */
    boolean delete(long id);

    int count();
}
