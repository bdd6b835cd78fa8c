package org.example.registration_flow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegistrationFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegistrationFlowApplication.class, args);
    }
}
