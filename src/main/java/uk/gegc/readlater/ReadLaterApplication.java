package uk.gegc.readlater;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReadLaterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReadLaterApplication.class, args);
    }
}
