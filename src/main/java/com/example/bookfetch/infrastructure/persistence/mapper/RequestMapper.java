package com.example.bookfetch.infrastructure.persistence.mapper;

import com.example.bookfetch.infrastructure.persistence.entity.RequestEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface RequestMapper {

    String COLUMNS = "id, user_id, audiobook_id, type, status, progress, error_message, parent_request_id, "
            + "import_attempts, max_import_retries, selected_transfer, search_attempts, last_search_at, "
            + "completed_at, deleted_at, created_at, updated_at";

    @Insert("INSERT INTO request(user_id, audiobook_id, type, status, progress, parent_request_id, "
            + "import_attempts, max_import_retries, search_attempts) "
            + "VALUES(#{userId}, #{audiobookId}, #{type}, #{status}, #{progress}, #{parentRequestId}, "
            + "#{importAttempts}, #{maxImportRetries}, #{searchAttempts})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(RequestEntity entity);

    @Select("SELECT " + COLUMNS + " FROM request WHERE id = #{id} AND deleted_at IS NULL")
    RequestEntity selectById(@Param("id") Long id);

    @Select("SELECT status FROM request WHERE id = #{id} AND deleted_at IS NULL")
    String selectStatusById(@Param("id") Long id);

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM request WHERE deleted_at IS NULL "
            + "<if test='status != null'>AND status = #{status} </if>"
            + "ORDER BY created_at DESC, id DESC LIMIT #{limit} OFFSET #{offset}"
            + "</script>")
    List<RequestEntity> selectPage(@Param("status") String status,
                                   @Param("limit") int limit,
                                   @Param("offset") int offset);

    @Select("<script>"
            + "SELECT COUNT(1) FROM request WHERE deleted_at IS NULL "
            + "<if test='status != null'>AND status = #{status} </if>"
            + "</script>")
    long countPage(@Param("status") String status);

    @Select("SELECT " + COLUMNS + " FROM request WHERE status = #{status} AND deleted_at IS NULL "
            + "ORDER BY updated_at ASC, id ASC LIMIT #{limit}")
    List<RequestEntity> selectByStatus(@Param("status") String status, @Param("limit") int limit);

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM request WHERE deleted_at IS NULL AND status IN "
            + "<foreach collection='statuses' item='s' open='(' separator=',' close=')'>#{s}</foreach> "
            + "ORDER BY updated_at ASC, id ASC LIMIT #{limit}"
            + "</script>")
    List<RequestEntity> selectByStatuses(@Param("statuses") List<String> statuses, @Param("limit") int limit);

    /**
     * Active requests for a book, optionally narrowed to one user.
     */
    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM request WHERE deleted_at IS NULL "
            + "AND audiobook_id = #{audiobookId} AND type = #{type} "
            + "<if test='userId != null'>AND user_id = #{userId} </if>"
            + "AND status IN "
            + "<foreach collection='statuses' item='s' open='(' separator=',' close=')'>#{s}</foreach> "
            + "ORDER BY created_at DESC"
            + "</script>")
    List<RequestEntity> selectForBook(@Param("audiobookId") Long audiobookId,
                                      @Param("type") String type,
                                      @Param("userId") Long userId,
                                      @Param("statuses") List<String> statuses);

    /**
     * Guarded status change. Returns 0 when the row is no longer in one of {@code fromStatuses},
     * which callers treat as "someone else (cancel, deny) got there first".
     */
    @Update("<script>"
            + "UPDATE request SET status = #{toStatus}, error_message = #{errorMessage}, updated_at = NOW() "
            + "WHERE id = #{id} AND deleted_at IS NULL AND status IN "
            + "<foreach collection='fromStatuses' item='s' open='(' separator=',' close=')'>#{s}</foreach>"
            + "</script>")
    int transition(@Param("id") Long id,
                   @Param("fromStatuses") List<String> fromStatuses,
                   @Param("toStatus") String toStatus,
                   @Param("errorMessage") String errorMessage);

    @Update("<script>"
            + "UPDATE request SET status = #{toStatus}, progress = #{progress}, error_message = NULL, "
            + "updated_at = NOW() "
            + "WHERE id = #{id} AND deleted_at IS NULL AND status IN "
            + "<foreach collection='fromStatuses' item='s' open='(' separator=',' close=')'>#{s}</foreach>"
            + "</script>")
    int transitionWithProgress(@Param("id") Long id,
                               @Param("fromStatuses") List<String> fromStatuses,
                               @Param("toStatus") String toStatus,
                               @Param("progress") int progress);

    @Update("UPDATE request SET status = 'searching', search_attempts = IFNULL(search_attempts, 0) + 1, "
            + "last_search_at = NOW(), error_message = NULL, updated_at = NOW() "
            + "WHERE id = #{id} AND deleted_at IS NULL AND status IN ('pending','awaiting_search','searching')")
    int markSearching(@Param("id") Long id);

    @Update("UPDATE request SET selected_transfer = #{selectedTransfer}, updated_at = NOW() "
            + "WHERE id = #{id} AND deleted_at IS NULL")
    int updateSelectedTransfer(@Param("id") Long id, @Param("selectedTransfer") String selectedTransfer);

    @Update("UPDATE request SET progress = #{progress}, updated_at = NOW() "
            + "WHERE id = #{id} AND status = 'downloading' AND deleted_at IS NULL")
    int updateDownloadProgress(@Param("id") Long id, @Param("progress") int progress);

    @Update("UPDATE request SET status = 'available', progress = 100, error_message = NULL, "
            + "completed_at = NOW(), updated_at = NOW() "
            + "WHERE id = #{id} AND status = 'processing' AND deleted_at IS NULL")
    int markAvailable(@Param("id") Long id);

    @Update("<script>"
            + "UPDATE request SET status = #{toStatus}, import_attempts = #{importAttempts}, "
            + "error_message = #{errorMessage}, updated_at = NOW() "
            + "WHERE id = #{id} AND deleted_at IS NULL AND status IN "
            + "<foreach collection='fromStatuses' item='s' open='(' separator=',' close=')'>#{s}</foreach>"
            + "</script>")
    int recordImportFailure(@Param("id") Long id,
                            @Param("fromStatuses") List<String> fromStatuses,
                            @Param("toStatus") String toStatus,
                            @Param("importAttempts") int importAttempts,
                            @Param("errorMessage") String errorMessage);

    @Update("UPDATE request SET import_attempts = 0, updated_at = NOW() WHERE id = #{id} AND deleted_at IS NULL")
    int resetImportAttempts(@Param("id") Long id);

    @Update("UPDATE request SET deleted_at = NOW(), updated_at = NOW() WHERE id = #{id} AND deleted_at IS NULL")
    int softDelete(@Param("id") Long id);
}
