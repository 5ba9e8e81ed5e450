package io.hivememory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * HiveMemory: access-controlled shared memory, pattern bank and learning state for
 * agent swarms.
 */
@SpringBootApplication
public class HiveMemoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(HiveMemoryApplication.class, args);
    }
}
