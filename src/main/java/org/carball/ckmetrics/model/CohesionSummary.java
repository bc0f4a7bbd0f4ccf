package org.carball.ckmetrics.model;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregate figures over a list of {@link ClassMetrics}. Everything is zero for an empty list.
 */
public record CohesionSummary(
    int totalClasses,
    int totalFiles,
    double avgWmc,
    double avgCbo,
    double avgRfc,
    double avgLcom,
    int maxWmc,
    int maxCbo,
    int maxRfc,
    int maxLcom,
    int maxDit,
    int lowCohesionCount
) {

    public static CohesionSummary empty() {
        return new CohesionSummary(0, 0, 0.0, 0.0, 0.0, 0.0, 0, 0, 0, 0, 0, 0);
    }

    public static CohesionSummary of(List<ClassMetrics> classes) {
        if (classes.isEmpty()) {
            return empty();
        }

        Set<Path> files = new HashSet<>();
        long totalWmc = 0, totalCbo = 0, totalRfc = 0, totalLcom = 0;
        int maxWmc = 0, maxCbo = 0, maxRfc = 0, maxLcom = 0, maxDit = 0;
        int lowCohesion = 0;

        for (ClassMetrics cls : classes) {
            files.add(cls.getPath());
            totalWmc += cls.getWmc();
            totalCbo += cls.getCbo();
            totalRfc += cls.getRfc();
            totalLcom += cls.getLcom();
            maxWmc = Math.max(maxWmc, cls.getWmc());
            maxCbo = Math.max(maxCbo, cls.getCbo());
            maxRfc = Math.max(maxRfc, cls.getRfc());
            maxLcom = Math.max(maxLcom, cls.getLcom());
            maxDit = Math.max(maxDit, cls.getDit());
            if (cls.getLcom() > 1) {
                lowCohesion++;
            }
        }

        double n = classes.size();
        return new CohesionSummary(
                classes.size(),
                files.size(),
                totalWmc / n,
                totalCbo / n,
                totalRfc / n,
                totalLcom / n,
                maxWmc, maxCbo, maxRfc, maxLcom, maxDit,
                lowCohesion);
    }
}
