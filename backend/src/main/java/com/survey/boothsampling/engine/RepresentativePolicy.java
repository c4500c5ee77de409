package com.survey.boothsampling.engine;

import com.survey.boothsampling.model.Cluster;
import com.survey.boothsampling.model.ClusteredBooth;

import java.util.List;

/**
 * Decides which members of a cluster represent it in the sample
 */
public interface RepresentativePolicy {

    /**
     * @param cluster cluster to pick from
     * @param limit   maximum number of booths to return
     * @return at most {@code limit} members of {@code cluster}, in selection order
     */
    List<ClusteredBooth> pick(Cluster cluster, int limit);
}
