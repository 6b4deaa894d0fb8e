package net.storefleet.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class StorefleetApplication {
    public static void main(String[] args) {
        SpringApplication.run(StorefleetApplication.class, args);
    }
}
