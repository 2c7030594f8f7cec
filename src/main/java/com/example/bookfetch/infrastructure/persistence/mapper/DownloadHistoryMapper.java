package com.example.bookfetch.infrastructure.persistence.mapper;

import com.example.bookfetch.infrastructure.persistence.entity.DownloadHistoryEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface DownloadHistoryMapper {

    String COLUMNS = "id, request_id, indexer_name, torrent_name, torrent_hash, torrent_size_bytes, seeders, "
            + "quality_score, selected, download_client, download_client_id, download_status, progress, "
            + "download_path, error_message, started_at, completed_at, created_at, updated_at";

    @Insert("INSERT INTO download_history(request_id, indexer_name, torrent_name, torrent_hash, torrent_size_bytes, "
            + "seeders, quality_score, selected, download_client, download_client_id, download_status, progress, "
            + "started_at) "
            + "VALUES(#{requestId}, #{indexerName}, #{torrentName}, #{torrentHash}, #{torrentSizeBytes}, "
            + "#{seeders}, #{qualityScore}, #{selected}, #{downloadClient}, #{downloadClientId}, #{downloadStatus}, "
            + "#{progress}, NOW())")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(DownloadHistoryEntity entity);

    @Select("SELECT " + COLUMNS + " FROM download_history WHERE id = #{id}")
    DownloadHistoryEntity selectById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM download_history WHERE request_id = #{requestId} AND selected = 1 "
            + "ORDER BY created_at DESC, id DESC LIMIT 1")
    DownloadHistoryEntity selectLatestByRequestId(@Param("requestId") Long requestId);

    @Select("SELECT " + COLUMNS + " FROM download_history WHERE request_id = #{requestId} AND selected = 1 "
            + "AND download_status = 'completed' ORDER BY completed_at DESC, id DESC LIMIT 1")
    DownloadHistoryEntity selectLatestCompletedByRequestId(@Param("requestId") Long requestId);

    @Update("UPDATE download_history SET progress = #{progress}, updated_at = NOW() "
            + "WHERE id = #{id} AND download_status = 'downloading'")
    int updateProgress(@Param("id") Long id, @Param("progress") int progress);

    @Update("UPDATE download_history SET download_status = 'completed', progress = 100, "
            + "download_path = #{downloadPath}, completed_at = NOW(), updated_at = NOW() "
            + "WHERE id = #{id} AND download_status = 'downloading'")
    int markCompleted(@Param("id") Long id, @Param("downloadPath") String downloadPath);

    @Update("UPDATE download_history SET download_status = #{status}, error_message = #{errorMessage}, "
            + "completed_at = NOW(), updated_at = NOW() "
            + "WHERE id = #{id} AND download_status = 'downloading'")
    int close(@Param("id") Long id, @Param("status") String status, @Param("errorMessage") String errorMessage);
}
