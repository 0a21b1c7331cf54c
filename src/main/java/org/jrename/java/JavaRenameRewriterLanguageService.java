package org.jrename.java;

import com.sun.source.tree.BlockTree;
import com.sun.source.tree.ClassTree;
import com.sun.source.tree.LambdaExpressionTree;
import com.sun.source.tree.MethodTree;
import com.sun.source.tree.StatementTree;
import com.sun.source.tree.VariableTree;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import javax.lang.model.SourceVersion;
import org.jrename.rename.AbstractRenameRewriterLanguageService;
import org.jrename.rename.CancellationToken;
import org.jrename.rename.RenameLocation;
import org.jrename.rename.RenameRewriterParameters;
import org.jrename.rename.RewriteResult;
import org.jrename.rename.SpanEdit;
import org.jrename.semantics.RenameSymbol;
import org.jrename.semantics.SymbolLocation;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.Solution;
import org.jrename.workspace.TextSpan;

public class JavaRenameRewriterLanguageService extends AbstractRenameRewriterLanguageService {
    private static final Logger LOG = Logger.getLogger("main");
    private static final String ALREADY_DEFINED = "compiler.err.already.defined";

    private final JavaCompilerService compiler;
    private final JavaSimplifier simplifier;

    public JavaRenameRewriterLanguageService(JavaCompilerService compiler) {
        this.compiler = compiler;
        this.simplifier = new JavaSimplifier(compiler);
    }

    @Override
    public RewriteResult annotateAndRename(RenameRewriterParameters parameters) {
        parameters.cancellationToken.throwIfCancellationRequested();
        var documentId = parameters.document.id;
        var compilation = compiler.compilation(parameters.originalSolution, documentId.projectId);
        var result = new JavaRenameRewriter(compilation, parameters).rewrite();
        LOG.fine(
                String.format(
                        "Rewrote %s: %d edits, %d annotations, %d conflict spans",
                        documentId,
                        result.edits.size(),
                        result.annotations.size(),
                        parameters.conflictLocationSpans.size()));
        return result;
    }

    /** Java binds names the same way whatever their spelling, so the replacement text is the only new name. */
    @Override
    public void tryAddPossibleNameConflicts(
            RenameSymbol symbol, String replacementText, Collection<String> possibleNameConflicts) {}

    @Override
    public List<SymbolLocation> computeDeclarationConflicts(
            String replacementText,
            RenameSymbol renamedSymbol,
            RenameSymbol renameSymbol,
            List<RenameSymbol> referencedSymbols,
            Solution baseSolution,
            Solution newSolution,
            CancellationToken cancellationToken) {
        cancellationToken.throwIfCancellationRequested();
        var declaration = renamedSymbol.firstSourceLocation();
        if (declaration.isEmpty()) return List.of();
        var projectId = declaration.get().documentId.get().projectId;
        var compilation = compiler.compilation(newSolution, projectId);
        var original = compiler.compilation(baseSolution, projectId);
        return new JavaDeclarationConflicts(compilation, original).find(renamedSymbol, replacementText);
    }

    @Override
    public List<SymbolLocation> computeImplicitReferenceConflicts(
            RenameSymbol renameSymbol,
            RenameSymbol renamedSymbol,
            List<RenameLocation> implicitReferenceLocations,
            CancellationToken cancellationToken) {
        return JavaImplicitConflicts.lostImplicitCalls(renameSymbol, renamedSymbol, implicitReferenceLocations);
    }

    @Override
    public List<SymbolLocation> computePossibleImplicitUsageConflicts(
            RenameSymbol renamedSymbol,
            Solution newSolution,
            SymbolLocation originalDeclarationLocation,
            CancellationToken cancellationToken) {
        var declaration = renamedSymbol.firstSourceLocation();
        if (declaration.isEmpty()) return List.of();
        var compilation = compiler.compilation(newSolution, declaration.get().documentId.get().projectId);
        if (!JavaImplicitConflicts.gainsImplicitCalls(compilation, renamedSymbol)) return List.of();
        return List.of(originalDeclarationLocation);
    }

    /**
     * Java rejects a local that reuses the name of a local in scope, and still binds later uses of the name to one of
     * them. Reports any such error in the method around {@code token}.
     */
    @Override
    public boolean localVariableConflict(
            Solution newSolution, DocumentId documentId, TextSpan token, List<RenameSymbol> newReferencedSymbols) {
        for (var symbol : newReferencedSymbols) {
            if (!symbol.kind.isLocal()) return false;
        }
        var compilation = compiler.compilation(newSolution, documentId.projectId);
        var model = compilation.semanticModel(documentId);
        var found = model.tokenAt(token.start);
        if (found.isEmpty()) return false;
        var scope = TextSpan.EMPTY;
        for (var path = found.get().path; path != null; path = path.getParentPath()) {
            if (path.getLeaf() instanceof MethodTree || path.getLeaf() instanceof LambdaExpressionTree) {
                scope = compilation.span(documentId, path.getLeaf());
                break;
            }
        }
        if (scope.isEmpty()) return false;
        var text = newSolution.document(documentId).text;
        var name = found.get().name;
        for (var d : compilation.diagnostics(documentId)) {
            if (!d.getCode().equals(ALREADY_DEFINED)) continue;
            if (!scope.contains((int) d.getPosition())) continue;
            var matcher = NameTokenScanner.namePattern(name).matcher(text);
            matcher.region((int) d.getStartPosition(), (int) d.getEndPosition());
            if (matcher.find()) return true;
        }
        return false;
    }

    @Override
    public boolean isIdentifierValid(String replacementText) {
        return SourceVersion.isIdentifier(replacementText) && !SourceVersion.isKeyword(replacementText);
    }

    /** The innermost statement around {@code position}, or the field it initializes. */
    @Override
    public Optional<TextSpan> expansionTargetForLocation(Solution baseSolution, DocumentId documentId, int position) {
        var compilation = compiler.compilation(baseSolution, documentId.projectId);
        var token = compilation.semanticModel(documentId).tokenAt(position);
        if (token.isEmpty()) return Optional.empty();
        for (var path = token.get().path; path != null; path = path.getParentPath()) {
            var leaf = path.getLeaf();
            if (leaf instanceof ClassTree) break;
            if (leaf instanceof VariableTree) {
                var parent = path.getParentPath().getLeaf();
                // parameters are part of a signature, not a statement
                if (parent instanceof MethodTree) break;
                if (parent instanceof LambdaExpressionTree) continue;
            }
            if (leaf instanceof StatementTree && !(leaf instanceof BlockTree)) {
                var span = compilation.span(documentId, leaf);
                if (!span.isEmpty()) return Optional.of(span);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<SpanEdit> simplify(
            Solution currentSolution,
            DocumentId documentId,
            String originalText,
            List<SpanEdit> edits,
            Collection<TextSpan> complexifiedSpans,
            CancellationToken cancellationToken) {
        return simplifier.simplify(
                currentSolution, documentId, originalText, edits, complexifiedSpans, cancellationToken);
    }
}
