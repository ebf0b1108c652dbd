package chronobeat.repository;

import chronobeat.model.IntervalPeriod;
import chronobeat.model.IntervalSchedule;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for interval schedules.
 * Every mutation bumps the change marker in the same transaction.
 */
public interface IntervalRepository {

    /**
     * Insert a new interval.
     *
     * @return the stored interval with its generated id
     */
    IntervalSchedule create(int every, IntervalPeriod period);

    Optional<IntervalSchedule> findById(long id);

    List<IntervalSchedule> findAll();

    /**
     * Replace every/period of an existing interval.
     *
     * @return true if the row existed
     */
    boolean update(IntervalSchedule interval);

    /**
     * Delete an interval nobody references.
     *
     * @return true if deleted, false if not found
     * @throws chronobeat.exception.ScheduleInUseException if any periodic task
     *                                                     references it
     */
    boolean delete(long id);

    int count();
}
