package com.survey.boothsampling.util;

import com.survey.boothsampling.dto.ClusterDTO;
import com.survey.boothsampling.model.Booth;
import com.survey.boothsampling.model.ClusteredBooth;
import com.survey.boothsampling.model.SelectionResult;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the GeoJSON payload a map client draws for one sampled region.
 * All positions are geographic, [longitude, latitude].
 */
public final class GeoJSONConverter {

    private GeoJSONConverter() {
    }

    public static Map<String, Object> convertToGeoJSON(SelectionResult result) {
        Set<Integer> selectedIndexes = selectedIndexes(result);
        List<Map<String, Object>> features = new ArrayList<>();

        for (ClusteredBooth clustered : result.getClusteredBooths()) {
            Booth booth = clustered.getBooth();
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("role", "booth");
            properties.put("booth", booth.getBoothCode());
            properties.put("cluster", clustered.getClusterId());
            properties.put("selected", selectedIndexes.contains(booth.getIndex()));
            features.add(feature(point(booth.getLongitude(), booth.getLatitude()), properties));
        }

        List<Coordinate> centers = result.getClusterCenters();
        for (int id = 0; id < centers.size(); id++) {
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put("role", "centroid");
            properties.put("cluster", id);
            features.add(feature(point(centers.get(id).x, centers.get(id).y), properties));
        }

        Map<String, Object> featureCollection = new LinkedHashMap<>();
        featureCollection.put("type", "FeatureCollection");
        featureCollection.put("features", features);
        return featureCollection;
    }

    public static List<ClusterDTO> convertToClusters(SelectionResult result) {
        List<Coordinate> centers = result.getClusterCenters();
        int[] counts = new int[centers.size()];
        int[] selected = new int[centers.size()];
        Envelope[] bounds = new Envelope[centers.size()];

        for (ClusteredBooth clustered : result.getClusteredBooths()) {
            int id = clustered.getClusterId();
            counts[id]++;
            if (bounds[id] == null) {
                bounds[id] = new Envelope();
            }
            bounds[id].expandToInclude(clustered.getBooth().getLongitude(), clustered.getBooth().getLatitude());
        }
        for (ClusteredBooth clustered : result.getSelectedBooths()) {
            selected[clustered.getClusterId()]++;
        }

        List<ClusterDTO> clusters = new ArrayList<>(centers.size());
        for (int id = 0; id < centers.size(); id++) {
            Envelope box = bounds[id] != null ? bounds[id] : new Envelope(centers.get(id));
            clusters.add(new ClusterDTO(
                    id,
                    new double[]{centers.get(id).x, centers.get(id).y},
                    counts[id],
                    selected[id],
                    new double[]{box.getMinX(), box.getMinY(), box.getMaxX(), box.getMaxY()}));
        }
        return clusters;
    }

    private static Set<Integer> selectedIndexes(SelectionResult result) {
        Set<Integer> indexes = new HashSet<>();
        for (ClusteredBooth clustered : result.getSelectedBooths()) {
            indexes.add(clustered.getBooth().getIndex());
        }
        return indexes;
    }

    private static Map<String, Object> feature(Map<String, Object> geometry, Map<String, Object> properties) {
        Map<String, Object> feature = new LinkedHashMap<>();
        feature.put("type", "Feature");
        feature.put("geometry", geometry);
        feature.put("properties", properties);
        return feature;
    }

    private static Map<String, Object> point(double longitude, double latitude) {
        Map<String, Object> geometry = new LinkedHashMap<>();
        geometry.put("type", "Point");
        geometry.put("coordinates", List.of(longitude, latitude));
        return geometry;
    }
}
