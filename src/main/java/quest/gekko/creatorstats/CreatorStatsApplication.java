package quest.gekko.creatorstats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CreatorStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreatorStatsApplication.class, args);
    }

}
