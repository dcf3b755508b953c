package com.scanq.spring;

import com.scanq.adapter.spring.ScanQueueAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the scan admission scheduler in a Spring Boot application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableScanQueue
 * public class MediaServerApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MediaServerApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ScanQueueAutoConfiguration.class)
public @interface EnableScanQueue {
}
