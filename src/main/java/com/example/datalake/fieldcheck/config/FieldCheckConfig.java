package com.example.datalake.fieldcheck.config;

import com.example.datalake.fieldcheck.dao.JdbcRecordStore;
import com.example.datalake.fieldcheck.dao.RecordStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class FieldCheckConfig {

    @Bean
    public RecordStore recordStore(JdbcTemplate jdbcTemplate, FieldCheckProperties properties) {
        FieldCheckProperties.Store store = properties.getStore();
        return new JdbcRecordStore(jdbcTemplate, store.getIdColumn(), store.getDisplayFormats());
    }
}
