package com.secureflow.ensemble.engine.neighbors;

import lombok.Value;

/**
 * A reference point returned by a nearest-neighbor query.
 */
@Value
public class Neighbor {
    /** Position of the point in the indexed corpus. */
    int index;
    double distance;
}
