package github.sarthakdev143.story_graph.service;

import github.sarthakdev143.story_graph.model.StoryNode;
import github.sarthakdev143.story_graph.model.layout.DropZone;
import github.sarthakdev143.story_graph.model.layout.GraphLayout;

import java.util.Collection;

public interface GraphLayoutEngine {

    GraphLayout computeLayout(Collection<StoryNode> nodes);

    DropZone resolveZone(double x, double y, GraphLayout layout);
}
