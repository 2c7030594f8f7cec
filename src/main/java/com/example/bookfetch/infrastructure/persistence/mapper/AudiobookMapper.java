package com.example.bookfetch.infrastructure.persistence.mapper;

import com.example.bookfetch.infrastructure.persistence.entity.AudiobookEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface AudiobookMapper {

    String COLUMNS = "id, title, author, narrator, asin, year, series, series_part, duration_minutes, "
            + "cover_art_url, cached_cover_path, file_path, status, created_at, updated_at";

    @Insert("INSERT INTO audiobook(title, author, narrator, asin, year, series, series_part, duration_minutes, "
            + "cover_art_url, cached_cover_path, status) "
            + "VALUES(#{title}, #{author}, #{narrator}, #{asin}, #{year}, #{series}, #{seriesPart}, "
            + "#{durationMinutes}, #{coverArtUrl}, #{cachedCoverPath}, #{status})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(AudiobookEntity entity);

    @Select("SELECT " + COLUMNS + " FROM audiobook WHERE id = #{id}")
    AudiobookEntity selectById(@Param("id") Long id);

    @Select("SELECT " + COLUMNS + " FROM audiobook WHERE asin = #{asin} LIMIT 1")
    AudiobookEntity selectByAsin(@Param("asin") String asin);

    @Update("UPDATE audiobook SET file_path = #{filePath}, status = #{status}, updated_at = NOW() WHERE id = #{id}")
    int updateFilePath(@Param("id") Long id, @Param("filePath") String filePath, @Param("status") String status);
}
