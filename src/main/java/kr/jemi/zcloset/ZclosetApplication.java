package kr.jemi.zcloset;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.modulith.Modulithic;

@Modulithic(sharedModules = { "common", "config" })
@SpringBootApplication
public class ZclosetApplication {
    public static void main(String[] args) {
        SpringApplication.run(ZclosetApplication.class, args);
    }
}
