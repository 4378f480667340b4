package kr.jemi.zcassa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.modulith.Modulithic;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@Modulithic(sharedModules = { "common", "config" })
@EnableAsync
@EnableScheduling
@SpringBootApplication
public class ZcassaApplication {
    public static void main(String[] args) {
        SpringApplication.run(ZcassaApplication.class, args);
    }
}
