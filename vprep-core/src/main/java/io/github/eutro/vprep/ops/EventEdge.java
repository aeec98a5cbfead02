package io.github.eutro.vprep.ops;

/**
 * The edge of an event control ({@code @(posedge clk)} and friends).
 */
public enum EventEdge {
    POSEDGE("posedge"),
    NEGEDGE("negedge"),
    EDGE("edge"),
    ;

    public final String keyword;

    EventEdge(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
