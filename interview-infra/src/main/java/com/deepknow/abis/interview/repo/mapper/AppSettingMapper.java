package com.deepknow.abis.interview.repo.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface AppSettingMapper {
    String getValue(@Param("key") String key);
    int upsert(@Param("key") String key, @Param("value") String value);
}
