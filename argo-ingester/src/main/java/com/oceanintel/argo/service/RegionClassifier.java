package com.oceanintel.argo.service;

import com.oceanintel.argo.config.ArgoIngestProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Labels a position with the first configured named box containing it, e.g.
 * "Arabian Sea" or "Bay of Bengal", falling back to the basin name.
 */
@Component
public class RegionClassifier {

    private final List<ArgoIngestProperties.NamedBox> boxes;
    private final String fallbackName;

    public RegionClassifier(ArgoIngestProperties properties) {
        this.boxes = List.copyOf(properties.getRegions().getBoxes());
        this.fallbackName = properties.getRegions().getFallbackName();
    }

    public String classify(double latitude, double longitude) {
        for (ArgoIngestProperties.NamedBox box : boxes) {
            if (latitude >= box.getLatMin() && latitude <= box.getLatMax()
                    && longitude >= box.getLonMin() && longitude <= box.getLonMax()) {
                return box.getName();
            }
        }
        return fallbackName;
    }
}
