package com.williamcallahan.refrender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point. Host applications contribute a
 * {@link com.williamcallahan.refrender.domain.references.ProjectDirectory} and one
 * {@link com.williamcallahan.refrender.domain.references.ReferenceObjectSource} bean per object type.
 */
@SpringBootApplication
public class ReferenceRendererApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReferenceRendererApplication.class, args);
    }
}
