package github.sarthakdev143.story_graph.config;

import github.sarthakdev143.story_graph.model.layout.LayoutConstants;
import github.sarthakdev143.story_graph.service.NodeWidthPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LayoutConfiguration {

    @Bean
    public NodeWidthPolicy nodeWidthPolicy() {
        // every clip gets the same base width, media length does not widen it
        return node -> LayoutConstants.BASE_NODE_WIDTH;
    }
}
