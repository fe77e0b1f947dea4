package tw.gc.auto.strategylab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StrategyLabApplication {

    public static void main(String[] args) {
        SpringApplication.run(StrategyLabApplication.class, args);
    }
}
