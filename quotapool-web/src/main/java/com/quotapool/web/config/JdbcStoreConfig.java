package com.quotapool.web.config;

import com.quotapool.dispatcher.store.CredentialStore;
import com.quotapool.web.repository.CredentialUsageRepository;
import com.quotapool.web.service.JdbcCredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;
import org.springframework.data.jdbc.core.convert.JdbcCustomConversions;
import org.springframework.data.relational.core.dialect.Dialect;

import java.time.Clock;
import java.util.List;

/**
 * SQLite 持久化配置：方言、类型转换与 JDBC 用量存储。
 */
@Slf4j
@Configuration
public class JdbcStoreConfig {

    /**
     * 注册 SQLite 方言：Spring Data JDBC 内置不认识 SQLite，需手动提供。
     */
    @Bean
    public Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }

    /**
     * SQLite 没有布尔类型，布尔列按 INTEGER 0/1 存取。
     */
    @Bean
    public JdbcCustomConversions jdbcCustomConversions() {
        return new JdbcCustomConversions(List.of(
                IntegerToBooleanConverter.INSTANCE,
                BooleanToIntegerConverter.INSTANCE));
    }

    @Bean
    @ConditionalOnProperty(name = "quotapool.dispatcher.storage-type", havingValue = "jdbc")
    public CredentialStore jdbcCredentialStore(CredentialUsageRepository repository, Clock quotaPoolClock) {
        log.info("使用 SQLite Key 用量存储（持久化模式）");
        return new JdbcCredentialStore(repository, quotaPoolClock);
    }

    @ReadingConverter
    enum IntegerToBooleanConverter implements Converter<Integer, Boolean> {
        INSTANCE;

        @Override
        public Boolean convert(Integer source) {
            return source != 0;
        }
    }

    @WritingConverter
    enum BooleanToIntegerConverter implements Converter<Boolean, Integer> {
        INSTANCE;

        @Override
        public Integer convert(Boolean source) {
            return source ? 1 : 0;
        }
    }
}
