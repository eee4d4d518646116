package uk.gegc.creatorbilling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CreatorBillingApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreatorBillingApplication.class, args);
    }
}
