package vn.com.fecredit.videoupload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EntityScan("vn.com.fecredit.videoupload.model")
@EnableJpaRepositories("vn.com.fecredit.videoupload.model")
public class VideoUploadApplication {
    /**
     * Entry point; delegates to Spring Boot's {@link SpringApplication}.
     *
     * @param args Command line arguments passed to the application.
     */
    public static void main(String[] args) {
        SpringApplication.run(VideoUploadApplication.class, args);
    }
}
