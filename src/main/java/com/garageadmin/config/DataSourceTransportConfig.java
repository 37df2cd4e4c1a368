package com.garageadmin.config;

import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

@Configuration
@Slf4j
public class DataSourceTransportConfig {

    /**
     * In production the hosted Postgres only accepts TLS, but its certificate
     * chain is not in our trust store: encrypt the link without verifying it.
     */
    @Bean
    public static BeanPostProcessor encryptedTransportPostProcessor(Environment environment) {
        boolean production = environment.getProperty("garage.production", Boolean.class, false);
        return new BeanPostProcessor() {
            @Override
            public Object postProcessBeforeInitialization(Object bean, String beanName) {
                if (production && bean instanceof HikariDataSource) {
                    ((HikariDataSource) bean).addDataSourceProperty("sslmode", "require");
                    log.info("Production mode: database connections use sslmode=require");
                }
                return bean;
            }
        };
    }
}
