/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.inspections.integration.ai;

/**
 * Prompt text sent with every inspection image.
 */
public final class AnalysisPrompts {

    private static final String IMAGE_ANALYSIS = """
            You are a certified construction safety inspector reviewing a photo taken on an active job site. \
            Identify every condition in the photo that may violate OSHA construction standards (29 CFR 1926).

            Look for, at minimum:
            - Fall protection: unprotected edges, missing guardrails, open holes, missing harnesses
            - Scaffolding: missing planking, guardrails or base plates, improper access
            - Ladders: damaged ladders, wrong angle, not extended above the landing
            - Electrical: exposed wiring, missing GFCI, damaged cords
            - PPE: missing hard hats, eye protection, high-visibility vests or gloves
            - Excavations: unprotected trench walls, spoil piles at the edge, no safe exit
            - Housekeeping: debris, tripping hazards, blocked walkways
            - Fire safety: missing extinguishers, improper fuel storage
            - Heavy equipment: unsafe operation, missing guards, workers in swing radius

            Only report what is visible. Do not guess about areas outside the frame.

            Respond with JSON only, no surrounding prose, in exactly this shape:
            {
              "violations": [
                {
                  "description": "what the hazard is",
                  "location": "where in the image",
                  "bounding_box": {"x": 0.0, "y": 0.0, "width": 0.0, "height": 0.0},
                  "confidence": "high | medium | low",
                  "category": "one of the categories above",
                  "severity": "critical | serious | other | recommendation",
                  "suggested_regulations": ["1926.501(b)(1)"]
                }
              ],
              "general_observations": "overall site conditions",
              "image_quality_notes": "anything limiting the analysis, such as blur or poor lighting"
            }

            Bounding box coordinates are fractions of the image size with the origin at the top-left corner. \
            Omit bounding_box when the hazard has no clear region. Return an empty violations array when nothing \
            is found.""";

    private AnalysisPrompts() {
    }

    /**
     * Builds the image analysis prompt, appending inspector notes when present.
     */
    public static String imageAnalysis(String inspectorContext) {
        if (inspectorContext == null || inspectorContext.isBlank()) {
            return IMAGE_ANALYSIS;
        }
        return IMAGE_ANALYSIS + "\n\nAdditional context from the inspector:\n" + inspectorContext.strip();
    }
}
