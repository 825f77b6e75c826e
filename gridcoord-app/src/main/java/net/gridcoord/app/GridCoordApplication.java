package net.gridcoord.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GridCoordApplication {
    public static void main(String[] args) {
        SpringApplication.run(GridCoordApplication.class, args);
    }
}
