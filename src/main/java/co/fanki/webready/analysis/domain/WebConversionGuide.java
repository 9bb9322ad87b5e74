package co.fanki.webready.analysis.domain;

import java.util.List;

/**
 * Narrative guide for moving the analyzed project to a web architecture.
 *
 * @param summary one-paragraph summary
 * @param reusableModules paths of files that can be reused unchanged
 * @param uiComponentsToReplace paths of UI files to rewrite for the web
 * @param recommendedApproach the architectural pattern to follow
 * @param estimatedComplexity the complexity bucket of the conversion
 * @param recommendations ordered, template-generated advice
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record WebConversionGuide(
        String summary,
        List<String> reusableModules,
        List<String> uiComponentsToReplace,
        String recommendedApproach,
        Complexity estimatedComplexity,
        List<String> recommendations
) {

    /**
     * Copies the lists so the guide stays immutable.
     */
    public WebConversionGuide {
        reusableModules = List.copyOf(reusableModules);
        uiComponentsToReplace = List.copyOf(uiComponentsToReplace);
        recommendations = List.copyOf(recommendations);
    }

}
