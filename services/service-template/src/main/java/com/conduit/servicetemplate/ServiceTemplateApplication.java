package com.conduit.servicetemplate;

import com.conduit.servicetemplate.config.GrpcServerProperties;
import com.conduit.servicetemplate.config.ServiceTemplateProperties;
import com.conduit.servicetemplate.config.TlsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Conduit service template, the reference Spring Boot application for a gRPC service.
 *
 * <p>To create a new service, copy this module and then:
 *
 * <ol>
 *   <li>Rename packages from {@code com.conduit.servicetemplate} to {@code com.conduit.yourservice}
 *   <li>Update {@code conduit.service.name} in application.yml
 *   <li>Declare each gRPC service implementation as a bean and list it, with the client names
 *       allowed to call it, under {@code conduit.grpc.server.services}
 * </ol>
 *
 * <p>The gRPC server starts with the application context and drains in-flight calls when the
 * context closes.
 */
@SpringBootApplication
@EnableConfigurationProperties({
    ServiceTemplateProperties.class,
    GrpcServerProperties.class,
    TlsProperties.class
})
public class ServiceTemplateApplication {

    private static final Logger log = LoggerFactory.getLogger(ServiceTemplateApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ServiceTemplateApplication.class, args);
        log.info("Conduit service template started");
    }
}
