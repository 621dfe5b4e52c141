package org.dxworks.uischema.analyzer;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;

/**
 * A parsed component source. Holds the tree so its nodes stay valid while the walk runs.
 * <p>
 * A TypeScript source with markup additionally carries a {@code markupOverlay}: the same text with its
 * type-only syntax blanked out, parsed with the JSX grammar. Byte offsets of both trees are identical.
 * Single-file components carry their template markup separately, since only their scripts are parsed.
 */
public final class ParsedSource {
    private final String source;
    private final byte[] sourceBytes;
    private final TSTree tree;
    private final SourceDialect dialect;
    private final ParsedSource markupOverlay;
    private final String templateMarkup;

    ParsedSource(String source, TSTree tree, SourceDialect dialect) {
        this(source, source.getBytes(StandardCharsets.UTF_8), tree, dialect, null, null);
    }

    private ParsedSource(String source, byte[] sourceBytes, TSTree tree, SourceDialect dialect,
                         ParsedSource markupOverlay, String templateMarkup) {
        this.source = source;
        this.sourceBytes = sourceBytes;
        this.tree = tree;
        this.dialect = dialect;
        this.markupOverlay = markupOverlay;
        this.templateMarkup = templateMarkup;
    }

    ParsedSource withMarkupOverlay(ParsedSource overlay) {
        return new ParsedSource(source, sourceBytes, tree, dialect, overlay, templateMarkup);
    }

    ParsedSource withTemplateMarkup(String markup) {
        return new ParsedSource(source, sourceBytes, tree, dialect, markupOverlay, markup);
    }

    public String getSource() {
        return source;
    }

    public byte[] getSourceBytes() {
        return sourceBytes;
    }

    public TSNode getRoot() {
        return tree.getRootNode();
    }

    public SourceDialect getDialect() {
        return dialect;
    }

    /**
     * JSX parse of this source with type syntax blanked, or {@code null} when the primary tree already covers
     * the markup.
     */
    public ParsedSource getMarkupOverlay() {
        return markupOverlay;
    }

    /**
     * Markup outside the script blocks of a single-file component, or {@code null} for plain scripts.
     */
    public String getTemplateMarkup() {
        return templateMarkup;
    }
}
