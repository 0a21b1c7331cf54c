package org.jrename.conflicts;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jrename.TestSolutions;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.Solution;
import org.jrename.workspace.TextSpan;
import org.junit.Before;
import org.junit.Test;

public class MutableConflictResolutionTest {
    private static final TextSpan SPAN = new TextSpan(10, 1);

    private Solution solution;
    private DocumentId document;
    private MutableConflictResolution resolution;

    @Before
    public void setup() {
        solution =
                TestSolutions.single(
                        "demo/Point.java", "package demo; class Point {}", "demo/Spot.java", "package demo; class Spot {}");
        document = solution.findDocumentByName(solution.projects().iterator().next().id, "demo/Point.java").get().id;
        resolution = new MutableConflictResolution(solution, new RenamedSpansTracker(), Map.of(), Map.of());
    }

    private RelatedLocation location(RelatedLocationType type, boolean isReference) {
        return new RelatedLocation(SPAN, document, type, isReference, Optional.empty());
    }

    private RelatedLocationType onlyType() {
        assertThat(resolution.relatedLocations(), hasSize(1));
        return resolution.relatedLocations().get(0).type;
    }

    @Test
    public void possiblyResolvableBecomesResolvedReference() {
        resolution.addRelatedLocation(location(RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT, true));
        resolution.addRelatedLocation(location(RelatedLocationType.NO_CONFLICT, true));
        assertThat(onlyType(), equalTo(RelatedLocationType.RESOLVED_REFERENCE_CONFLICT));
    }

    @Test
    public void possiblyResolvableBecomesResolvedNonReference() {
        resolution.addRelatedLocation(location(RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT, false));
        resolution.addRelatedLocation(location(RelatedLocationType.NO_CONFLICT, false));
        assertThat(onlyType(), equalTo(RelatedLocationType.RESOLVED_NON_REFERENCE_CONFLICT));
    }

    @Test
    public void finalOutcomeNeverChanges() {
        resolution.addRelatedLocation(location(RelatedLocationType.UNRESOLVABLE_CONFLICT, true));
        resolution.addRelatedLocation(location(RelatedLocationType.NO_CONFLICT, true));
        resolution.addRelatedLocation(location(RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT, true));
        assertThat(onlyType(), equalTo(RelatedLocationType.UNRESOLVABLE_CONFLICT));
    }

    @Test
    public void keepsReferenceFlagOfFirstReport() {
        resolution.addRelatedLocation(location(RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT, true));
        resolution.addRelatedLocation(location(RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT, false));
        assertTrue(resolution.relatedLocations().get(0).isReference);
    }

    @Test
    public void keepsComplexifiedTarget() {
        var target = Optional.of(new TextSpan(5, 20));
        resolution.addRelatedLocation(
                new RelatedLocation(SPAN, document, RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT, true, target));
        resolution.addRelatedLocation(location(RelatedLocationType.NO_CONFLICT, true));
        assertThat(resolution.relatedLocations().get(0).complexifiedTargetSpan, equalTo(target));
    }

    @Test
    public void updateIgnoresUnknownLocations() {
        resolution.updateRelatedLocationIfPresent(location(RelatedLocationType.NO_CONFLICT, true));
        assertThat(resolution.relatedLocations(), empty());
    }

    @Test
    public void replaceOverridesFinalOutcome() {
        resolution.addRelatedLocation(location(RelatedLocationType.RESOLVED_REFERENCE_CONFLICT, true));
        resolution.addOrReplaceRelatedLocation(location(RelatedLocationType.UNRESOLVABLE_CONFLICT, true));
        assertThat(onlyType(), equalTo(RelatedLocationType.UNRESOLVABLE_CONFLICT));
    }

    @Test
    public void downgradeLeftoverConflicts() {
        resolution.addRelatedLocation(location(RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT, true));
        resolution.downgradePossiblyResolvableConflicts();
        assertThat(onlyType(), equalTo(RelatedLocationType.UNRESOLVED_CONFLICT));
        assertThat(resolution.toConflictResolution().unresolvedConflictCount(), equalTo(1));
    }

    @Test
    public void locationsKeepFirstReportedOrder() {
        var later = new RelatedLocation(new TextSpan(2, 1), document, RelatedLocationType.NO_CONFLICT);
        resolution.addRelatedLocation(location(RelatedLocationType.NO_CONFLICT, true));
        resolution.addRelatedLocation(later);
        resolution.addRelatedLocation(location(RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT, true));
        assertThat(resolution.relatedLocations().get(0).conflictCheckSpan, equalTo(SPAN));
        assertThat(resolution.relatedLocations().get(0).type, equalTo(RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT));
    }

    @Test
    public void renameDocumentUnlessNameIsTaken() {
        resolution.renameDocumentToMatchNewSymbol(document, "Spot");
        assertThat(resolution.currentSolution().document(document).name, equalTo("demo/Point.java"));
        resolution.renameDocumentToMatchNewSymbol(document, "Place");
        assertThat(resolution.currentSolution().document(document).name, equalTo("demo/Place.java"));
        assertThat(resolution.toConflictResolution().renamedDocuments(), hasEntry(document, "Place.java"));
    }

    @Test
    public void clearDocumentsRestoresText() {
        var changed = solution.withDocumentText(document, "package demo; class Spot {}");
        resolution.updateCurrentSolution(changed);
        resolution.clearDocuments(List.of(document));
        assertThat(resolution.currentSolution().document(document).text, equalTo("package demo; class Point {}"));
    }
}
