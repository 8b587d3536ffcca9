package github.sarthakdev143.story_graph.service;

import github.sarthakdev143.story_graph.model.StoryNode;
import github.sarthakdev143.story_graph.model.timeline.TimelineState;

import java.util.Collection;

public interface TimelineProjector {

    TimelineState project(Collection<StoryNode> nodes);
}
