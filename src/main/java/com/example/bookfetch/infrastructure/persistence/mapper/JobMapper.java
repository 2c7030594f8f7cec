package com.example.bookfetch.infrastructure.persistence.mapper;

import com.example.bookfetch.infrastructure.persistence.entity.JobEntity;
import com.example.bookfetch.infrastructure.persistence.model.JobStatusCountRow;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

/**
 * Job ledger. Every update is scoped to one row and guarded by the statuses it may leave.
 */
@Mapper
public interface JobMapper {

    String COLUMNS = "id, broker_job_id, request_id, type, status, priority, attempts, max_attempts, payload, "
            + "result, error_message, stack_trace, started_at, completed_at, created_at, updated_at";

    @Insert("INSERT INTO job(broker_job_id, request_id, type, status, priority, attempts, max_attempts, payload) "
            + "VALUES(#{brokerJobId}, #{requestId}, #{type}, #{status}, #{priority}, #{attempts}, #{maxAttempts}, "
            + "#{payload})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(JobEntity entity);

    @Select("SELECT " + COLUMNS + " FROM job WHERE id = #{id}")
    JobEntity selectById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM job WHERE broker_job_id = #{brokerJobId} LIMIT 1")
    JobEntity selectByBrokerJobId(@Param("brokerJobId") String brokerJobId);

    @Select("SELECT " + COLUMNS + " FROM job WHERE request_id = #{requestId} ORDER BY created_at DESC, id DESC")
    List<JobEntity> selectByRequestId(@Param("requestId") Long requestId);

    @Select("SELECT " + COLUMNS + " FROM job WHERE status = #{status} ORDER BY updated_at DESC, id DESC "
            + "LIMIT #{limit}")
    List<JobEntity> selectByStatus(@Param("status") String status, @Param("limit") int limit);

    @Select("SELECT " + COLUMNS + " FROM job WHERE request_id = #{requestId} AND status IN ('pending','stuck')")
    List<JobEntity> selectCancellableByRequestId(@Param("requestId") Long requestId);

    /**
     * Rows that may have been lost with the previous process.
     */
    @Select("SELECT " + COLUMNS + " FROM job WHERE status IN ('pending','active','stuck') "
            + "AND created_at >= #{since} ORDER BY priority DESC, id ASC LIMIT #{limit}")
    List<JobEntity> selectRecoverable(@Param("since") LocalDateTime since, @Param("limit") int limit);

    @Select("SELECT status, COUNT(1) AS total FROM job GROUP BY status")
    List<JobStatusCountRow> countByStatus();

    @Update("UPDATE job SET broker_job_id = #{brokerJobId}, updated_at = NOW() WHERE id = #{id}")
    int updateBrokerJobId(@Param("id") Long id, @Param("brokerJobId") String brokerJobId);

    @Update("UPDATE job SET status = 'active', attempts = #{attempts}, started_at = NOW(), updated_at = NOW() "
            + "WHERE id = #{id} AND status IN ('pending','stuck')")
    int markActive(@Param("id") Long id, @Param("attempts") int attempts);

    @Update("UPDATE job SET status = 'completed', result = #{result}, error_message = NULL, stack_trace = NULL, "
            + "completed_at = NOW(), updated_at = NOW() WHERE id = #{id} AND status IN ('active','stuck')")
    int markCompleted(@Param("id") Long id, @Param("result") String result);

    /**
     * Attempt failed but the broker will run it again.
     */
    @Update("UPDATE job SET status = 'pending', attempts = #{attempts}, error_message = #{errorMessage}, "
            + "stack_trace = #{stackTrace}, updated_at = NOW() WHERE id = #{id} AND status IN ('active','stuck')")
    int markRetrying(@Param("id") Long id,
                     @Param("attempts") int attempts,
                     @Param("errorMessage") String errorMessage,
                     @Param("stackTrace") String stackTrace);

    @Update("UPDATE job SET status = 'failed', attempts = #{attempts}, error_message = #{errorMessage}, "
            + "stack_trace = #{stackTrace}, completed_at = NOW(), updated_at = NOW() "
            + "WHERE id = #{id} AND status IN ('pending','active','stuck')")
    int markFailed(@Param("id") Long id,
                   @Param("attempts") int attempts,
                   @Param("errorMessage") String errorMessage,
                   @Param("stackTrace") String stackTrace);

    @Update("UPDATE job SET status = 'stuck', updated_at = NOW() WHERE id = #{id} AND status = 'active'")
    int markStuck(@Param("id") Long id);

    @Update("UPDATE job SET status = 'cancelled', completed_at = NOW(), updated_at = NOW() "
            + "WHERE id = #{id} AND status IN ('pending','stuck')")
    int cancel(@Param("id") Long id);

    @Update("UPDATE job SET status = 'pending', attempts = 0, error_message = NULL, stack_trace = NULL, "
            + "result = NULL, started_at = NULL, completed_at = NULL, updated_at = NOW() "
            + "WHERE id = #{id} AND status IN ('failed','stuck','cancelled')")
    int resetForRetry(@Param("id") Long id);
}
