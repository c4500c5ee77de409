package com.survey.boothsampling.engine;

import com.survey.boothsampling.model.Booth;
import com.survey.boothsampling.model.Cluster;
import com.survey.boothsampling.model.ClusteringOutcome;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Partitions the valid booths of one region into K geographic groups with seeded k-means
 * over (longitude, latitude). Identical input order, K and seed always give identical clusters.
 * <p>
 * When there are at least two booths per cluster every cluster keeps at least two members,
 * so a lone outlier cannot starve its cluster. Booths sharing one location may be split
 * across clusters with the same centroid.
 */
@Component
@Slf4j
public class SpatialClusteringEngine {

    private final int maxIterations;
    private final long seed;
    private final int restarts;

    public SpatialClusteringEngine(
            @Value("${sampling.clustering.max-iterations:300}") int maxIterations,
            @Value("${sampling.clustering.seed:42}") long seed,
            @Value("${sampling.clustering.restarts:10}") int restarts) {
        this.maxIterations = Math.max(1, maxIterations);
        this.seed = seed;
        this.restarts = Math.max(1, restarts);
    }

    /**
     * @param booths   valid booths of one region, at least one
     * @param clusters requested number of clusters, at least one
     * @return clusters numbered 0..K'-1 where K' is below {@code clusters} only when there are
     *         fewer booths than requested clusters
     */
    public ClusteringOutcome cluster(List<Booth> booths, int clusters) {
        if (booths == null || booths.isEmpty()) {
            throw new IllegalArgumentException("Cannot cluster an empty booth set");
        }
        if (clusters < 1) {
            throw new IllegalArgumentException("Cluster count must be positive, got " + clusters);
        }

        double[][] points = toPoints(booths);
        int k = Math.min(clusters, points.length);
        if (k < clusters) {
            log.debug("Reducing cluster count from {} to {} booths", clusters, k);
        }
        int minMembers = points.length >= 2 * k ? 2 : 1;

        Run best = null;
        for (int attempt = 0; attempt < restarts; attempt++) {
            Run run = lloyd(points, k, minMembers, new Random(seed + attempt));
            if (best == null || run.inertia < best.inertia) {
                best = run;
            }
        }

        List<Cluster> result = buildClusters(booths, points, best.assignment, k);
        return ClusteringOutcome.builder()
                .clusters(result)
                .requestedClusters(clusters)
                .iterations(best.iterations)
                .inertia(best.inertia)
                .build();
    }

    private Run lloyd(double[][] points, int k, int minMembers, Random random) {
        double[][] centers = seedCenters(points, k, random);
        int[] assignment = new int[points.length];
        Arrays.fill(assignment, -1);

        int iteration = 0;
        while (iteration < maxIterations) {
            iteration++;
            boolean changed = assign(points, centers, assignment);
            if (!changed) {
                break;
            }
            updateCenters(points, centers, assignment);
        }

        if (fillSmallClusters(points, centers, assignment, minMembers)) {
            recomputeCenters(points, centers, assignment);
        }

        double inertia = 0;
        for (int i = 0; i < points.length; i++) {
            inertia += squaredDistance(points[i], centers[assignment[i]]);
        }
        return new Run(assignment, inertia, iteration);
    }

    // k-means++ seeding: each next center is drawn with probability proportional to D^2
    private double[][] seedCenters(double[][] points, int k, Random random) {
        double[][] centers = new double[k][];
        centers[0] = points[random.nextInt(points.length)].clone();

        double[] nearest = new double[points.length];
        Arrays.fill(nearest, Double.MAX_VALUE);
        for (int c = 1; c < k; c++) {
            double total = 0;
            for (int i = 0; i < points.length; i++) {
                nearest[i] = Math.min(nearest[i], squaredDistance(points[i], centers[c - 1]));
                total += nearest[i];
            }

            int chosen = -1;
            double target = random.nextDouble() * total;
            double cumulative = 0;
            for (int i = 0; i < points.length; i++) {
                cumulative += nearest[i];
                if (nearest[i] > 0 && cumulative >= target) {
                    chosen = i;
                    break;
                }
            }
            if (chosen < 0) {
                chosen = farthestFromCenters(nearest);
            }
            centers[c] = points[chosen].clone();
        }
        return centers;
    }

    // A point only moves to a strictly closer center, so coincident centers keep their members
    private boolean assign(double[][] points, double[][] centers, int[] assignment) {
        boolean changed = false;
        for (int i = 0; i < points.length; i++) {
            int closest = assignment[i] >= 0 ? assignment[i] : 0;
            double closestDistance = squaredDistance(points[i], centers[closest]);
            for (int c = 0; c < centers.length; c++) {
                double d = squaredDistance(points[i], centers[c]);
                if (d < closestDistance) {
                    closest = c;
                    closestDistance = d;
                }
            }
            if (assignment[i] != closest) {
                assignment[i] = closest;
                changed = true;
            }
        }
        return changed;
    }

    private void updateCenters(double[][] points, double[][] centers, int[] assignment) {
        int k = centers.length;
        double[][] sums = new double[k][2];
        int[] counts = new int[k];
        for (int i = 0; i < points.length; i++) {
            sums[assignment[i]][0] += points[i][0];
            sums[assignment[i]][1] += points[i][1];
            counts[assignment[i]]++;
        }

        for (int c = 0; c < k; c++) {
            if (counts[c] > 0) {
                centers[c][0] = sums[c][0] / counts[c];
                centers[c][1] = sums[c][1] / counts[c];
            } else {
                // Empty cluster takes over the point worst served by its current center
                int donor = worstServedPoint(points, centers, assignment, counts);
                counts[assignment[donor]]--;
                assignment[donor] = c;
                counts[c] = 1;
                centers[c] = points[donor].clone();
            }
        }
    }

    /**
     * Tops up every cluster holding fewer than {@code minMembers} booths with the nearest booths of
     * clusters that can spare one. Callers guarantee {@code points.length >= k * minMembers}.
     *
     * @return whether any booth moved
     */
    private boolean fillSmallClusters(double[][] points, double[][] centers, int[] assignment, int minMembers) {
        int k = centers.length;
        int[] counts = new int[k];
        for (int c : assignment) {
            counts[c]++;
        }

        boolean moved = false;
        for (int c = 0; c < k; c++) {
            while (counts[c] < minMembers) {
                int donor = -1;
                double donorDistance = Double.MAX_VALUE;
                for (int i = 0; i < points.length; i++) {
                    if (counts[assignment[i]] <= minMembers) {
                        continue;
                    }
                    double d = squaredDistance(points[i], centers[c]);
                    if (d < donorDistance) {
                        donor = i;
                        donorDistance = d;
                    }
                }
                if (donor < 0) {
                    throw new IllegalStateException("No booth left to fill cluster " + c);
                }
                counts[assignment[donor]]--;
                assignment[donor] = c;
                counts[c]++;
                moved = true;
            }
        }
        return moved;
    }

    private static void recomputeCenters(double[][] points, double[][] centers, int[] assignment) {
        double[][] sums = new double[centers.length][2];
        int[] counts = new int[centers.length];
        for (int i = 0; i < points.length; i++) {
            sums[assignment[i]][0] += points[i][0];
            sums[assignment[i]][1] += points[i][1];
            counts[assignment[i]]++;
        }
        for (int c = 0; c < centers.length; c++) {
            if (counts[c] > 0) {
                centers[c][0] = sums[c][0] / counts[c];
                centers[c][1] = sums[c][1] / counts[c];
            }
        }
    }

    private int worstServedPoint(double[][] points, double[][] centers, int[] assignment, int[] counts) {
        int worst = -1;
        double worstDistance = -1;
        for (int i = 0; i < points.length; i++) {
            if (counts[assignment[i]] < 2) {
                continue;
            }
            double d = squaredDistance(points[i], centers[assignment[i]]);
            if (d > worstDistance) {
                worst = i;
                worstDistance = d;
            }
        }
        return worst >= 0 ? worst : 0;
    }

    private int farthestFromCenters(double[] nearest) {
        int farthest = 0;
        for (int i = 1; i < nearest.length; i++) {
            if (nearest[i] > nearest[farthest]) {
                farthest = i;
            }
        }
        return farthest;
    }

    /**
     * Builds the final clusters, renumbered in order of first member so ids do not depend on
     * which center happened to be seeded first. Centroids are the exact member means.
     */
    private List<Cluster> buildClusters(List<Booth> booths, double[][] points, int[] assignment, int k) {
        Map<Integer, List<Integer>> membersByCenter = new LinkedHashMap<>();
        for (int i = 0; i < assignment.length; i++) {
            membersByCenter.computeIfAbsent(assignment[i], key -> new ArrayList<>()).add(i);
        }
        if (membersByCenter.size() < k) {
            log.debug("{} of {} clusters ended empty and were dropped", k - membersByCenter.size(), k);
        }

        List<Cluster> clusters = new ArrayList<>(membersByCenter.size());
        int id = 0;
        for (List<Integer> indexes : membersByCenter.values()) {
            double sumX = 0;
            double sumY = 0;
            List<Booth> members = new ArrayList<>(indexes.size());
            for (int index : indexes) {
                sumX += points[index][0];
                sumY += points[index][1];
                members.add(booths.get(index));
            }
            clusters.add(Cluster.builder()
                    .id(id++)
                    .centroid(new Coordinate(sumX / indexes.size(), sumY / indexes.size()))
                    .members(members)
                    .build());
        }
        return clusters;
    }

    private static double[][] toPoints(List<Booth> booths) {
        double[][] points = new double[booths.size()][];
        for (int i = 0; i < booths.size(); i++) {
            Booth booth = booths.get(i);
            points[i] = new double[]{booth.getLongitude(), booth.getLatitude()};
        }
        return points;
    }

    static double squaredDistance(double[] a, double[] b) {
        double dx = a[0] - b[0];
        double dy = a[1] - b[1];
        return dx * dx + dy * dy;
    }

    private static final class Run {
        private final int[] assignment;
        private final double inertia;
        private final int iterations;

        private Run(int[] assignment, double inertia, int iterations) {
            this.assignment = assignment;
            this.inertia = inertia;
            this.iterations = iterations;
        }
    }
}
