package com.example.bookfetch.infrastructure.persistence.mapper;

import com.example.bookfetch.infrastructure.persistence.entity.ScheduledJobEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface ScheduledJobMapper {

    String COLUMNS = "id, name, type, schedule, enabled, payload, last_run, next_run, created_at, updated_at";

    @Insert("INSERT INTO scheduled_job(name, type, schedule, enabled, payload, next_run) "
            + "VALUES(#{name}, #{type}, #{schedule}, #{enabled}, #{payload}, #{nextRun})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(ScheduledJobEntity entity);

    @Select("SELECT " + COLUMNS + " FROM scheduled_job ORDER BY id ASC")
    List<ScheduledJobEntity> selectAll();

    @Select("SELECT " + COLUMNS + " FROM scheduled_job WHERE id = #{id}")
    ScheduledJobEntity selectById(@Param("id") Long id);

    @Select("SELECT COUNT(1) FROM scheduled_job WHERE type = #{type}")
    int countByType(@Param("type") String type);

    @Update("UPDATE scheduled_job SET name = #{name}, schedule = #{schedule}, enabled = #{enabled}, "
            + "payload = #{payload}, next_run = #{nextRun}, updated_at = NOW() WHERE id = #{id}")
    int update(ScheduledJobEntity entity);

    @Update("UPDATE scheduled_job SET last_run = #{lastRun}, next_run = #{nextRun}, updated_at = NOW() "
            + "WHERE id = #{id}")
    int updateRunTimes(@Param("id") Long id,
                       @Param("lastRun") LocalDateTime lastRun,
                       @Param("nextRun") LocalDateTime nextRun);

    @Delete("DELETE FROM scheduled_job WHERE id = #{id}")
    int deleteById(@Param("id") Long id);
}
