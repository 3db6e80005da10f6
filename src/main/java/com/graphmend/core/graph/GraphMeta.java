package com.graphmend.core.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class GraphMeta {

    private List<String>          roots              = new ArrayList<>();
    private List<String>          leaves             = new ArrayList<>();
    private Map<String, Position> suggestedPositions = new LinkedHashMap<>();
    private String                source;

    public GraphMeta() {
    }

    public GraphMeta(String source) {
        this.source = source;
    }

    public List<String>          getRoots()              { return roots; }
    public List<String>          getLeaves()             { return leaves; }
    public Map<String, Position> getSuggestedPositions() { return suggestedPositions; }
    public String                getSource()             { return source; }

    public void setRoots(List<String> roots) {
        this.roots = roots != null ? new ArrayList<>(roots) : new ArrayList<>();
    }

    public void setLeaves(List<String> leaves) {
        this.leaves = leaves != null ? new ArrayList<>(leaves) : new ArrayList<>();
    }

    public void setSuggestedPositions(Map<String, Position> positions) {
        this.suggestedPositions = positions != null ? new LinkedHashMap<>(positions) : new LinkedHashMap<>();
    }

    public void setSource(String source) {
        this.source = source;
    }

    public GraphMeta copy() {
        GraphMeta copy = new GraphMeta(source);
        copy.setRoots(roots);
        copy.setLeaves(leaves);
        copy.setSuggestedPositions(suggestedPositions);
        return copy;
    }
}
