package ch.wordgame;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the word game backend.
 *
 * <p>Enables:
 * <ul>
 *   <li>Spring Boot auto-configuration</li>
 *   <li>Component scanning for the entire application</li>
 *   <li>Scheduled task execution ({@code @EnableScheduling}) for idle game eviction</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class WordGameBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(WordGameBackendApplication.class, args);
    }

}
