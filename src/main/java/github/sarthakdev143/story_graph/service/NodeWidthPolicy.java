package github.sarthakdev143.story_graph.service;

import github.sarthakdev143.story_graph.model.StoryNode;

@FunctionalInterface
public interface NodeWidthPolicy {

    double baseWidth(StoryNode node);
}
