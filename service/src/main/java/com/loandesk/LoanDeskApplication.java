package com.loandesk;

import com.loandesk.config.LoanDeskProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(LoanDeskProperties.class)
public class LoanDeskApplication {
    public static void main(String[] args) {
        SpringApplication.run(LoanDeskApplication.class, args);
    }
}
