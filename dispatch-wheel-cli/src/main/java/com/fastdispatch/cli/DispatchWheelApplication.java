package com.fastdispatch.cli;

import com.fastdispatch.annotation.EnableDispatchWheel;
import com.fastdispatch.config.DispatchWheelProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

@Slf4j
@EnableDispatchWheel
@SpringBootApplication
public class DispatchWheelApplication {

    public static void main(String[] args) {
        String[] springArgs;
        try {
            springArgs = DispatchArgs.toSpringArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }
        System.exit(SpringApplication.exit(SpringApplication.run(DispatchWheelApplication.class, springArgs)));
    }

    /**
     * 启动参数回显，先于调度执行
     */
    @Bean
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public ApplicationRunner startupLine(DispatchWheelProperties props,
                                         @Value("${spring.datasource.url:}") String jdbcUrl) {
        return args -> log.info("Dispatcher starting with {} jobs, max_retries={}, mean={}ms, stddev={}ms, db={}",
                props.getJobs(), props.getDefaultMaxRetry(), props.serviceMeanMillis(),
                props.serviceStddevMillis(), DispatchArgs.dbPath(jdbcUrl));
    }
}
