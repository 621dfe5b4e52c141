package org.dxworks.uischema.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.uischema.analyzer.TreeSitterHelper.containsErrors;
import static org.dxworks.uischema.analyzer.TreeSitterHelper.findFirstDescendantOfTypes;
import static org.dxworks.uischema.analyzer.TreeSitterHelper.getChildByFieldName;
import static org.dxworks.uischema.analyzer.TreeSitterHelper.isAbsent;
import static org.dxworks.uischema.analyzer.TreeSitterHelper.isNodeTypeOneOf;

/**
 * Turns component source text into a Tree-sitter tree.
 * <p>
 * The TypeScript grammar is tried first. When it reports errors and the JavaScript grammar (which supports JSX)
 * parses the same text cleanly, the JSX tree wins. When neither is clean, as for a {@code .tsx} component that
 * declares an interface and renders markup, the TypeScript tree is kept and a JSX parse of the text with its
 * type syntax blanked is attached as markup overlay. Single-file components are reduced to their script blocks;
 * their remaining markup travels with the result.
 */
public class SourceParser {
    private static final Logger logger = LogManager.getLogger(SourceParser.class);

    private static final Pattern SCRIPT_BLOCK = Pattern.compile("(?is)<script\\b[^>]*>(.*?)</script>");
    private static final Pattern STYLE_BLOCK = Pattern.compile("(?is)<style\\b[^>]*>.*?</style>");

    private static final String[] MARKUP_ELEMENTS = {"jsx_element", "jsx_self_closing_element"};
    private static final String[] TYPE_ONLY_NODES = {
            "interface_declaration", "type_alias_declaration", "enum_declaration", "ambient_declaration",
            "type_annotation", "type_parameters"
    };

    private final int maxSourceLines;

    public SourceParser(int maxSourceLines) {
        this.maxSourceLines = maxSourceLines;
    }

    public ParsedSource parse(String componentName, String sourceText) {
        if (sourceText == null || sourceText.isBlank()) {
            throw new ParseFailureException("No source text for " + componentName);
        }

        String source = sourceText.startsWith("\uFEFF") ? sourceText.substring(1) : sourceText;
        long lines = source.lines().count();
        if (lines > maxSourceLines) {
            throw new ParseFailureException("Source of " + componentName + " has " + lines
                    + " lines, limit is " + maxSourceLines);
        }

        String templateMarkup = templateOf(source);
        source = scriptOf(source);

        ParsedSource parsed = parseWith(SourceDialect.TYPESCRIPT, source);
        if (containsErrors(parsed.getRoot())) {
            ParsedSource jsx = parseWith(SourceDialect.JAVASCRIPT_JSX, source);
            if (!containsErrors(jsx.getRoot())) {
                parsed = jsx;
            } else {
                ParsedSource overlay = parseWith(SourceDialect.JAVASCRIPT_JSX, maskTypeSyntax(parsed));
                if (findFirstDescendantOfTypes(overlay.getRoot(), MARKUP_ELEMENTS) != null) {
                    parsed = parsed.withMarkupOverlay(overlay);
                }
            }
        }
        logger.debug("Parsed {} as {}{}", componentName, parsed.getDialect().getName(),
                parsed.getMarkupOverlay() == null ? "" : " with markup overlay");

        if (!isTraversable(parsed.getRoot())) {
            throw new ParseFailureException("Source of " + componentName + " has no well-formed top-level node");
        }
        return templateMarkup == null ? parsed : parsed.withTemplateMarkup(templateMarkup);
    }

    /**
     * Single-file components ({@code .vue}, {@code .svelte}) start with markup; only their script blocks are code.
     */
    static String scriptOf(String source) {
        if (!isSingleFileComponent(source)) return source;

        Matcher matcher = SCRIPT_BLOCK.matcher(source);
        StringBuilder scripts = new StringBuilder();
        while (matcher.find()) {
            scripts.append(matcher.group(1)).append('\n');
        }
        return scripts.length() == 0 ? source : scripts.toString();
    }

    /**
     * The markup of a single-file component: everything outside its script and style blocks.
     */
    static String templateOf(String source) {
        if (!isSingleFileComponent(source)) return null;

        String markup = STYLE_BLOCK.matcher(SCRIPT_BLOCK.matcher(source).replaceAll("")).replaceAll("");
        return markup.isBlank() ? null : markup;
    }

    private static boolean isSingleFileComponent(String source) {
        return source.stripLeading().startsWith("<");
    }

    /**
     * Blanks declarations and annotations the JSX grammar cannot read. Line breaks are kept and every other
     * masked byte becomes a space, so offsets in the masked text match the original.
     * <p>
     * Type arguments stay: {@code useState<string>('')} still reads as JavaScript comparisons, and the TypeScript
     * grammar reports misread markup such as {@code <span>{text}} as a type assertion with type arguments.
     */
    static String maskTypeSyntax(ParsedSource typescript) {
        byte[] masked = typescript.getSourceBytes().clone();

        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(typescript.getRoot());
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (isTypeOnly(node)) {
                int end = Math.min(masked.length, node.getEndByte());
                for (int i = Math.max(0, node.getStartByte()); i < end; i++) {
                    if (masked[i] != '\n' && masked[i] != '\r') masked[i] = ' ';
                }
                continue;
            }
            for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getNamedChild(i);
                if (!isAbsent(child)) stack.push(child);
            }
        }
        return new String(masked, StandardCharsets.UTF_8);
    }

    private static boolean isTypeOnly(TSNode node) {
        if (isNodeTypeOneOf(node, TYPE_ONLY_NODES)) return true;
        // `export interface ...` must go as a whole, a bare `export` is not valid JavaScript
        if (!isNodeTypeOneOf(node, "export_statement")) return false;
        TSNode declaration = getChildByFieldName(node, "declaration");
        return isNodeTypeOneOf(declaration, TYPE_ONLY_NODES);
    }

    private static ParsedSource parseWith(SourceDialect dialect, String source) {
        TSParser parser = new TSParser();
        parser.setLanguage(dialect.grammar());
        TSTree tree = parser.parseString(null, source);
        if (tree == null) {
            throw new ParseFailureException("Parser returned no tree for dialect " + dialect.getName());
        }
        return new ParsedSource(source, tree, dialect);
    }

    private static boolean isTraversable(TSNode root) {
        if (isAbsent(root) || "ERROR".equals(root.getType())) return false;
        if (!containsErrors(root)) return true;

        for (int i = 0; i < root.getNamedChildCount(); i++) {
            TSNode child = root.getNamedChild(i);
            if (!isAbsent(child) && !"comment".equals(child.getType()) && !containsErrors(child)) {
                return true;
            }
        }
        return false;
    }
}
