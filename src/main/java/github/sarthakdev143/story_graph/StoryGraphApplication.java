package github.sarthakdev143.story_graph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StoryGraphApplication {

	public static void main(String[] args) {
		SpringApplication.run(StoryGraphApplication.class, args);
	}

}
