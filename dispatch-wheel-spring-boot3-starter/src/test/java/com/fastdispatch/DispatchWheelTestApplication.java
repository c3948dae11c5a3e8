package com.fastdispatch;

import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;

/**
 * 仅开启自动配置，不做组件扫描
 */
@SpringBootConfiguration
@EnableAutoConfiguration
public class DispatchWheelTestApplication {
}
