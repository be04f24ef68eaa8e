package com.williamcallahan.orderedlists;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OrderedListsApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderedListsApplication.class, args);
    }
}
