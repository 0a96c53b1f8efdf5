package application;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"application", "common", "engine", "model", "service"})
public class PerimeterSimApplication {
    public static void main(String[] args) {
        SpringApplication.run(PerimeterSimApplication.class, args);
    }
}
