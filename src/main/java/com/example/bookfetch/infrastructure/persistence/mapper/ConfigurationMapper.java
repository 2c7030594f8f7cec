package com.example.bookfetch.infrastructure.persistence.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface ConfigurationMapper {

    @Select("SELECT config_value FROM configuration WHERE config_key = #{key}")
    String selectValue(@Param("key") String key);
}
