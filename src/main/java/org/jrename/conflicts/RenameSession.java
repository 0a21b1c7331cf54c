package org.jrename.conflicts;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import org.jrename.conflicts.annotations.RenameActionAnnotation;
import org.jrename.conflicts.annotations.RenameAnnotation;
import org.jrename.conflicts.annotations.RenameInvalidIdentifierAnnotation;
import org.jrename.conflicts.annotations.RenameNodeSimplificationAnnotation;
import org.jrename.rename.CancellationToken;
import org.jrename.rename.DocumentRenameInfo;
import org.jrename.rename.LanguageServices;
import org.jrename.rename.LanguageServicesRegistry;
import org.jrename.rename.LocationRenameContext;
import org.jrename.rename.RenameOptions;
import org.jrename.rename.RenameRewriterParameters;
import org.jrename.rename.RenamedSymbolContext;
import org.jrename.rename.SpanEdit;
import org.jrename.rename.SymbolicRenameLocations;
import org.jrename.semantics.RenameSymbol;
import org.jrename.semantics.StringSearch;
import org.jrename.semantics.SymbolKey;
import org.jrename.semantics.SymbolKind;
import org.jrename.semantics.SymbolLocation;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.ProjectId;
import org.jrename.workspace.Solution;
import org.jrename.workspace.TextSpan;

/**
 * Renames a set of symbols across a solution and resolves the conflicts the new names introduce.
 *
 * <p>Projects are processed in dependency order. Each project goes through at most four phases. Every phase rewrites
 * its documents from their original text, expanding the nodes around conflicts found in the previous phase, and
 * then checks every annotated name again. Once all projects are done, the declaration and implicit conflicts of the
 * renamed symbols are added.
 *
 * <p>A session is used once, on one thread.
 */
class RenameSession {
    private static final Logger LOG = Logger.getLogger("main");
    private static final int MAX_PHASE = 3;

    private final LanguageServicesRegistry languages;
    private final Solution baseSolution;
    private final List<SymbolicRenameLocations> renameLocationsSet;
    private final ImmutableMap<SymbolKey, String> replacementTexts;
    private final ImmutableMap<SymbolKey, Boolean> replacementTextValid;
    private final RenameOptions options;
    private final Set<DocumentId> documentIdsToBeCheckedForConflict;
    private final Map<DocumentId, DocumentRenameInfo> documentRenameInfos;
    private final CancellationToken cancellationToken;

    private final AnnotationTable<RenameAnnotation> annotations = new AnnotationTable<>();
    private Set<ConflictLocationInfo> conflictLocations = new LinkedHashSet<>();

    private RenameSession(
            LanguageServicesRegistry languages,
            Solution baseSolution,
            List<SymbolicRenameLocations> renameLocationsSet,
            Map<SymbolKey, String> replacementTexts,
            Map<SymbolKey, Boolean> replacementTextValid,
            RenameOptions options,
            Set<DocumentId> documentIdsToBeCheckedForConflict,
            Map<DocumentId, DocumentRenameInfo> documentRenameInfos,
            CancellationToken cancellationToken) {
        this.languages = languages;
        this.baseSolution = baseSolution;
        this.renameLocationsSet = renameLocationsSet;
        this.replacementTexts = ImmutableMap.copyOf(replacementTexts);
        this.replacementTextValid = ImmutableMap.copyOf(replacementTextValid);
        this.options = options;
        this.documentIdsToBeCheckedForConflict = documentIdsToBeCheckedForConflict;
        this.documentRenameInfos = documentRenameInfos;
        this.cancellationToken = cancellationToken;
    }

    /**
     * Works out which documents have to be checked and what each of them needs to know about the rename.
     *
     * @throws org.jrename.rename.LocationRenameContextOverlappingException if two symbols rename the same span
     *     differently
     */
    static RenameSession create(
            LanguageServicesRegistry languages,
            Solution baseSolution,
            List<SymbolicRenameLocations> renameLocationsSet,
            Map<SymbolKey, String> replacementTexts,
            RenameOptions options,
            CancellationToken cancellationToken) {
        var validity = new LinkedHashMap<SymbolKey, Boolean>();
        var symbolContexts = new ArrayList<RenamedSymbolContext>();
        var documentsToCheck = new LinkedHashSet<DocumentId>();
        for (var renameLocations : renameLocationsSet) {
            cancellationToken.throwIfCancellationRequested();
            var symbol = renameLocations.symbol;
            var replacementText = replacementTexts.get(symbol.key);
            var declaringDocument = symbol.firstSourceLocation().get().documentId.get();
            var services = languages.forDocument(baseSolution, declaringDocument);
            var affected = services.finder.documentsAffectedByRename(baseSolution, renameLocations);

            var involvedLanguages = new LinkedHashSet<String>();
            involvedLanguages.add(services.language);
            for (var id : affected) {
                involvedLanguages.add(baseSolution.project(id.projectId).language);
            }
            var possibleNameConflicts = new ArrayList<String>();
            var valid = true;
            for (var language : involvedLanguages) {
                var rewriter = languages.forLanguage(language).rewriter;
                rewriter.tryAddPossibleNameConflicts(symbol, replacementText, possibleNameConflicts);
                valid &= rewriter.isIdentifierValid(replacementText);
            }
            validity.put(symbol.key, valid);
            symbolContexts.add(
                    new RenamedSymbolContext(replacementText, symbol.name, possibleNameConflicts, symbol, valid));

            for (var location : renameLocations.locations) {
                documentsToCheck.add(location.documentId);
            }
            var names = new LinkedHashSet<String>();
            names.add(replacementText);
            names.add(symbol.name);
            names.addAll(possibleNameConflicts);
            for (var id : affected) {
                if (documentsToCheck.contains(id)) continue;
                var text = baseSolution.document(id).text;
                for (var name : names) {
                    if (StringSearch.containsWord(text, name)) {
                        documentsToCheck.add(id);
                        break;
                    }
                }
            }
            LOG.info(
                    String.format(
                            "Renaming %s to `%s`: %d locations, %d affected documents%s",
                            symbol,
                            replacementText,
                            renameLocations.locations.size(),
                            affected.size(),
                            valid ? "" : ", replacement is not a valid identifier"));
        }

        var infos = new LinkedHashMap<DocumentId, DocumentRenameInfo>();
        for (var id : documentsToCheck) {
            infos.put(id, DocumentRenameInfo.EMPTY);
        }
        for (var i = 0; i < renameLocationsSet.size(); i++) {
            var renameLocations = renameLocationsSet.get(i);
            var context = symbolContexts.get(i);
            for (var location : renameLocations.locations) {
                var locationContext =
                        new LocationRenameContext(
                                location, context.replacementText, context.originalText, context.replacementTextValid);
                var info = infos.get(location.documentId);
                if (location.isStringOrComment()) {
                    info = info.withStringAndCommentRenameContext(locationContext);
                } else {
                    info = info.withLocationRenameContext(locationContext);
                }
                infos.put(location.documentId, info);
            }
        }
        for (var entry : infos.entrySet()) {
            var info = entry.getValue();
            for (var context : symbolContexts) {
                info = info.withRenamedSymbolContext(context);
            }
            entry.setValue(info);
        }
        return new RenameSession(
                languages,
                baseSolution,
                renameLocationsSet,
                replacementTexts,
                validity,
                options,
                documentsToCheck,
                infos,
                cancellationToken);
    }

    Set<DocumentId> documentsToCheck() {
        return ImmutableSet.copyOf(documentIdsToBeCheckedForConflict);
    }

    MutableConflictResolution resolve() {
        var conflictResolution =
                new MutableConflictResolution(
                        baseSolution, new RenamedSpansTracker(), replacementTexts, replacementTextValid);
        var documentsByProject = new LinkedHashMap<ProjectId, List<DocumentId>>();
        for (var id : documentIdsToBeCheckedForConflict) {
            documentsByProject.computeIfAbsent(id.projectId, k -> new ArrayList<>()).add(id);
        }
        for (var projectId : baseSolution.dependencyGraph().topologicallySortedProjects()) {
            var documentIds = documentsByProject.get(projectId);
            if (documentIds == null) continue;
            resolveProject(conflictResolution, projectId, documentIds);
        }

        var renamedSymbols = validRenamedSymbolsInfo(conflictResolution);
        addImplicitConflicts(conflictResolution, renamedSymbols);
        conflictResolution.downgradePossiblyResolvableConflicts();
        addDeclarationConflicts(conflictResolution, renamedSymbols);
        if (options.renameFile) {
            renameFiles(conflictResolution);
        }
        return conflictResolution;
    }

    private void resolveProject(
            MutableConflictResolution conflictResolution, ProjectId projectId, List<DocumentId> documentIds) {
        var services = languages.forProject(baseSolution, projectId);
        conflictLocations = new LinkedHashSet<>();
        var documentIdsThatGetsAnnotatedAndRenamed = new LinkedHashSet<>(documentIds);
        var phase = 0;
        while (true) {
            cancellationToken.throwIfCancellationRequested();
            LOG.fine(
                    String.format(
                            "Phase %d of %s: rewriting %d documents",
                            phase, projectId, documentIdsThatGetsAnnotatedAndRenamed.size()));
            annotateAndRename(conflictResolution, services, documentIdsThatGetsAnnotatedAndRenamed);
            var foundResolvableConflicts = identifyConflicts(conflictResolution, services, projectId, documentIds);
            if (!foundResolvableConflicts || phase == MAX_PHASE) break;

            if (phase == 0) {
                conflictLocations = possiblyResolvableLocations(conflictResolution, documentIds, true);
                // No reference needs expanding, go straight to expanding everything
                if (conflictLocations.isEmpty()) phase++;
            }
            if (phase == 1) {
                conflictLocations.addAll(possiblyResolvableLocations(conflictResolution, documentIds, false));
            }
            documentIdsThatGetsAnnotatedAndRenamed = new LinkedHashSet<>();
            for (var location : conflictLocations) {
                documentIdsThatGetsAnnotatedAndRenamed.add(location.documentId);
            }
            if (phase == 2) {
                // Expanding these again would not help
                dropUnresolvedConflictLocations(conflictResolution);
            }
            conflictResolution.clearDocuments(documentIdsThatGetsAnnotatedAndRenamed);
            annotations.clear(documentIdsThatGetsAnnotatedAndRenamed);
            phase++;
        }
        if (allReplacementTextsValid()) {
            simplify(conflictResolution, services, documentIds);
        }
        annotations.clear(documentIds);
        LOG.info(String.format("Finished %s after phase %d", projectId, phase));
    }

    private void annotateAndRename(
            MutableConflictResolution conflictResolution,
            LanguageServices services,
            Set<DocumentId> documentIdsThatGetsAnnotatedAndRenamed) {
        var newTexts = new LinkedHashMap<DocumentId, String>();
        var unchanged = new ArrayList<DocumentId>();
        for (var documentId : documentIdsThatGetsAnnotatedAndRenamed) {
            cancellationToken.throwIfCancellationRequested();
            var spans = new ArrayList<TextSpan>();
            for (var location : conflictLocations) {
                if (location.documentId.equals(documentId)) spans.add(location.complexifiedSpan);
            }
            var parameters =
                    new RenameRewriterParameters(
                            spans,
                            baseSolution,
                            baseSolution.document(documentId),
                            documentRenameInfos.get(documentId),
                            cancellationToken);
            var result = services.rewriter.annotateAndRename(parameters);
            conflictResolution.renamedSpansTracker.setEdits(documentId, result.edits);
            annotations.clear(documentId);
            for (var annotated : result.annotations) {
                annotations.add(documentId, annotated.span, annotated.annotation);
            }
            newTexts.put(documentId, result.newText);
            if (result.isUnchanged()) unchanged.add(documentId);
        }
        conflictResolution.updateCurrentSolution(conflictResolution.currentSolution().withDocumentTexts(newTexts));
        documentIdsThatGetsAnnotatedAndRenamed.removeAll(unchanged);
    }

    /** Checks every annotated name of the project again. Returns whether a conflict may still be resolved. */
    private boolean identifyConflicts(
            MutableConflictResolution conflictResolution,
            LanguageServices services,
            ProjectId projectId,
            List<DocumentId> documentIds) {
        var renamedSymbols = validRenamedSymbolsInfo(conflictResolution);
        if (renamedSymbols.isEmpty()) {
            // Nothing can be checked against an invalid name; every rename location is unresolved
            for (var documentId : documentIds) {
                for (var action : annotations.annotations(documentId, RenameActionAnnotation.class)) {
                    if (!action.isRenameLocation) continue;
                    conflictResolution.addRelatedLocation(
                            new RelatedLocation(
                                    action.originalSpan,
                                    documentId,
                                    RelatedLocationType.UNRESOLVED_CONFLICT,
                                    true,
                                    Optional.empty()));
                }
            }
            return false;
        }
        var renamedKeys = new HashSet<SymbolKey>();
        for (var info : renamedSymbols) {
            renamedKeys.add(info.renamedSymbol.key);
        }
        var currentSolution = conflictResolution.currentSolution();
        var compilation = services.semantics.compile(currentSolution, projectId);
        ConflictChecker.PositionAdjuster adjuster =
                (documentId, start) -> conflictResolution.getAdjustedTokenStartingPosition(start, documentId);
        for (var documentId : documentIds) {
            cancellationToken.throwIfCancellationRequested();
            if (annotations.isEmpty(documentId)) continue;
            var model = compilation.semanticModel(documentId);
            var complexified = complexifiedIdentifierSpans(documentId);
            for (var span : annotations.annotatedSpans(documentId)) {
                for (var action : annotations.annotations(documentId, span, RenameActionAnnotation.class)) {
                    cancellationToken.throwIfCancellationRequested();
                    var hasConflict =
                            annotations.hasAnnotation(documentId, span, RenameInvalidIdentifierAnnotation.class);
                    List<RenameSymbol> newSymbols = List.of();
                    if (!hasConflict) {
                        newSymbols =
                                action.isInvocationExpression
                                        ? model.symbolsForEnclosingInvocation(span.start)
                                        : model.symbolsTouching(span.start);
                        if (!bindsToNonConflictSymbol(newSymbols)) {
                            hasConflict = ConflictChecker.checkForConflict(action, newSymbols, renamedKeys, adjuster);
                            if (!hasConflict && !action.isInvocationExpression) {
                                hasConflict =
                                        services.rewriter.localVariableConflict(
                                                currentSolution, documentId, span, newSymbols);
                            }
                        }
                    }
                    recordOutcome(conflictResolution, services, documentId, action, hasConflict, complexified);
                }
            }
        }
        for (var location : conflictResolution.relatedLocations()) {
            if (location.type == RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT
                    && location.documentId.projectId.equals(projectId)) {
                return true;
            }
        }
        return false;
    }

    private void recordOutcome(
            MutableConflictResolution conflictResolution,
            LanguageServices services,
            DocumentId documentId,
            RenameActionAnnotation action,
            boolean hasConflict,
            Set<TextSpan> complexified) {
        var originalSpan = action.originalSpan;
        if (!hasConflict) {
            if (action.isRenameLocation) {
                var type =
                        complexified.contains(originalSpan)
                                ? RelatedLocationType.RESOLVED_REFERENCE_CONFLICT
                                : RelatedLocationType.NO_CONFLICT;
                conflictResolution.addRelatedLocation(
                        new RelatedLocation(originalSpan, documentId, type, true, Optional.empty()));
            } else if (!action.isOriginalTextLocation && complexified.contains(originalSpan)) {
                conflictResolution.addRelatedLocation(
                        new RelatedLocation(
                                originalSpan,
                                documentId,
                                RelatedLocationType.RESOLVED_NON_REFERENCE_CONFLICT,
                                false,
                                Optional.empty()));
            } else {
                conflictResolution.updateRelatedLocationIfPresent(
                        new RelatedLocation(
                                originalSpan, documentId, RelatedLocationType.NO_CONFLICT, false, Optional.empty()));
            }
            return;
        }
        var target = services.rewriter.expansionTargetForLocation(baseSolution, documentId, originalSpan.start);
        var type =
                target.isPresent()
                        ? RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT
                        : RelatedLocationType.UNRESOLVABLE_CONFLICT;
        conflictResolution.addRelatedLocation(
                new RelatedLocation(originalSpan, documentId, type, action.isRenameLocation, target));
    }

    private boolean bindsToNonConflictSymbol(List<RenameSymbol> newSymbols) {
        for (var symbol : newSymbols) {
            if (options.nonConflictSymbols.contains(symbol.key)) return true;
        }
        return false;
    }

    private Set<TextSpan> complexifiedIdentifierSpans(DocumentId documentId) {
        var spans = new HashSet<TextSpan>();
        for (var location : conflictLocations) {
            if (location.documentId.equals(documentId)) spans.add(location.originalIdentifierSpan);
        }
        return spans;
    }

    private Set<ConflictLocationInfo> possiblyResolvableLocations(
            MutableConflictResolution conflictResolution, Collection<DocumentId> documentIds, boolean referencesOnly) {
        var result = new LinkedHashSet<ConflictLocationInfo>();
        for (var location : conflictResolution.relatedLocations()) {
            if (location.type != RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT) continue;
            if (referencesOnly && !location.isReference) continue;
            if (!documentIds.contains(location.documentId)) continue;
            result.add(new ConflictLocationInfo(location));
        }
        return result;
    }

    private void dropUnresolvedConflictLocations(MutableConflictResolution conflictResolution) {
        var unresolved = new ArrayList<RelatedLocation>();
        for (var location : conflictResolution.relatedLocations()) {
            if (location.type.isUnresolved() && location.complexifiedTargetSpan.isPresent()) unresolved.add(location);
        }
        var kept = new LinkedHashSet<ConflictLocationInfo>();
        for (var location : conflictLocations) {
            var drop = false;
            for (var conflict : unresolved) {
                if (conflict.documentId.equals(location.documentId)
                        && conflict.complexifiedTargetSpan.get().contains(location.originalIdentifierSpan)) {
                    drop = true;
                    break;
                }
            }
            if (!drop) kept.add(location);
        }
        conflictLocations = kept;
    }

    private boolean allReplacementTextsValid() {
        return !replacementTextValid.containsValue(false);
    }

    /** Removes the qualifiers added while resolving conflicts wherever the plain name binds the same way. */
    private void simplify(
            MutableConflictResolution conflictResolution, LanguageServices services, List<DocumentId> documentIds) {
        var tracker = conflictResolution.renamedSpansTracker;
        for (var documentId : documentIds) {
            cancellationToken.throwIfCancellationRequested();
            var complexified = new ArrayList<TextSpan>();
            for (var annotation : annotations.annotations(documentId, RenameNodeSimplificationAnnotation.class)) {
                complexified.add(annotation.originalTextSpan);
            }
            if (complexified.isEmpty()) continue;
            var originalText = baseSolution.document(documentId).text;
            var edits = tracker.edits(documentId);
            List<SpanEdit> simplified =
                    services.rewriter.simplify(
                            conflictResolution.currentSolution(),
                            documentId,
                            originalText,
                            edits,
                            complexified,
                            cancellationToken);
            if (simplified.equals(edits)) continue;
            LOG.fine(
                    String.format(
                            "Simplified %s: %d of %d edits kept", documentId, simplified.size(), edits.size()));
            tracker.setEdits(documentId, simplified);
            var newText = SpanEdit.apply(originalText, tracker.edits(documentId));
            conflictResolution.updateCurrentSolution(
                    conflictResolution.currentSolution().withDocumentText(documentId, newText));
        }
    }

    /** The renamed symbols with a valid replacement, found again at their declaration in the current snapshot. */
    private List<RenamedSymbolInfo> validRenamedSymbolsInfo(MutableConflictResolution conflictResolution) {
        var result = new ArrayList<RenamedSymbolInfo>();
        var currentSolution = conflictResolution.currentSolution();
        for (var renameLocations : renameLocationsSet) {
            var symbol = renameLocations.symbol;
            if (!replacementTextValid.get(symbol.key)) continue;
            var declaration = symbol.firstSourceLocation().get();
            var documentId = declaration.documentId.get();
            var services = languages.forDocument(currentSolution, documentId);
            var position = conflictResolution.getAdjustedTokenStartingPosition(declaration.span.start, documentId);
            var renamed =
                    services.semantics
                            .compile(currentSolution, documentId.projectId)
                            .semanticModel(documentId)
                            .symbolAt(position);
            if (renamed.isEmpty()) {
                LOG.warning(String.format("Lost track of %s after renaming it", symbol));
                continue;
            }
            result.add(
                    new RenamedSymbolInfo(
                            renameLocations, replacementTexts.get(symbol.key), declaration, renamed.get()));
        }
        return result;
    }

    private void addImplicitConflicts(
            MutableConflictResolution conflictResolution, List<RenamedSymbolInfo> renamedSymbols) {
        for (var info : renamedSymbols) {
            cancellationToken.throwIfCancellationRequested();
            var documentId = info.originalDeclarationLocation.documentId.get();
            var rewriter = languages.forDocument(baseSolution, documentId).rewriter;
            var usageConflicts =
                    rewriter.computePossibleImplicitUsageConflicts(
                            info.renamedSymbol,
                            conflictResolution.currentSolution(),
                            info.originalDeclarationLocation,
                            cancellationToken);
            var implicitLocations = info.renameLocations.implicitLocations;
            var referenceConflicts =
                    implicitLocations.isEmpty()
                            ? List.<SymbolLocation>of()
                            : rewriter.computeImplicitReferenceConflicts(
                                    info.originalSymbol(), info.renamedSymbol, implicitLocations, cancellationToken);
            var conflicts = new ArrayList<>(usageConflicts);
            conflicts.addAll(referenceConflicts);
            for (var location : conflicts) {
                if (!location.isInSource()) continue;
                conflictResolution.addOrReplaceRelatedLocation(
                        new RelatedLocation(
                                location.span, location.documentId.get(), RelatedLocationType.UNRESOLVABLE_CONFLICT));
            }
        }
    }

    private void addDeclarationConflicts(
            MutableConflictResolution conflictResolution, List<RenamedSymbolInfo> renamedSymbols) {
        var tracker = conflictResolution.renamedSpansTracker;
        for (var info : renamedSymbols) {
            cancellationToken.throwIfCancellationRequested();
            if (!info.nameChanged()) continue;
            var documentId = info.originalDeclarationLocation.documentId.get();
            var rewriter = languages.forDocument(baseSolution, documentId).rewriter;
            var conflicts =
                    rewriter.computeDeclarationConflicts(
                            info.replacementText,
                            info.renamedSymbol,
                            info.originalSymbol(),
                            info.renameLocations.referencedSymbols,
                            baseSolution,
                            conflictResolution.currentSolution(),
                            cancellationToken);
            for (var location : conflicts) {
                if (!location.isInSource()) continue;
                var conflictDocument = location.documentId.get();
                var originalSpan = tracker.getOriginalSpan(location.span, conflictDocument);
                conflictResolution.addOrReplaceRelatedLocation(
                        new RelatedLocation(
                                originalSpan, conflictDocument, RelatedLocationType.UNRESOLVABLE_CONFLICT));
            }
        }
    }

    private void renameFiles(MutableConflictResolution conflictResolution) {
        for (var renameLocations : renameLocationsSet) {
            var symbol = renameLocations.symbol;
            if (symbol.kind != SymbolKind.TYPE) continue;
            if (!replacementTextValid.get(symbol.key)) continue;
            var declaringDocuments = new LinkedHashSet<DocumentId>();
            for (var location : symbol.locations) {
                if (location.isInSource()) declaringDocuments.add(location.documentId.get());
            }
            if (declaringDocuments.size() != 1) continue;
            var documentId = declaringDocuments.iterator().next();
            var fileName = baseSolution.document(documentId).fileName();
            var dot = fileName.lastIndexOf('.');
            var baseName = dot == -1 ? fileName : fileName.substring(0, dot);
            if (!baseName.equals(symbol.name)) continue;
            conflictResolution.renameDocumentToMatchNewSymbol(documentId, replacementTexts.get(symbol.key));
        }
    }
}
