package com.fastdispatch.autoconfig;

import com.baomidou.mybatisplus.extension.spring.MybatisSqlSessionFactoryBean;
import com.fastdispatch.core.sink.MybatisMetricsSink;
import com.fastdispatch.mapper.DispatchRunMapper;
import com.fastdispatch.mapper.JobAttemptMapper;
import org.apache.ibatis.session.SqlSessionFactory;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * 存在 DataSource 时把运行指标落库
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass({
        SqlSessionFactory.class,
        MybatisSqlSessionFactoryBean.class
})
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "dispatch.sink.db", name = "enabled", havingValue = "true", matchIfMissing = true)
@MapperScan(basePackages = "com.fastdispatch.mapper")
public class DispatchWheelMybatisAutoConfiguration {

    @Bean
    public MybatisMetricsSink mybatisMetricsSink(DispatchRunMapper runMapper, JobAttemptMapper jobMapper) {
        return new MybatisMetricsSink(runMapper, jobMapper);
    }
}
