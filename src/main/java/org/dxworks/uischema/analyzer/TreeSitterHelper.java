package org.dxworks.uischema.analyzer;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

public final class TreeSitterHelper {

    private TreeSitterHelper() {
        // utility class
    }

    /**
     * Tree-sitter reports UTF-8 byte offsets while Java strings are UTF-16, so slicing goes through the encoded bytes.
     */
    public static String getNodeText(byte[] sourceBytes, TSNode node) {
        if (isAbsent(node)) return null;
        int startByte = Math.max(0, node.getStartByte());
        int endByte = Math.min(sourceBytes.length, node.getEndByte());
        if (startByte >= endByte) return "";

        String text = new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
        // Normalize line endings to LF for cross-platform consistency
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }

    /**
     * Collapse all whitespace (including newlines and tabs) to single spaces and trim.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    public static boolean isAbsent(TSNode node) {
        return node == null || node.isNull();
    }

    public static int lineOf(TSNode node) {
        if (isAbsent(node)) return -1;
        return node.getStartPoint().getRow() + 1;
    }

    public static TSNode getChildByFieldName(TSNode parent, String fieldName) {
        if (isAbsent(parent)) return null;
        TSNode child = parent.getChildByFieldName(fieldName);
        return isAbsent(child) ? null : child;
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (isAbsent(node)) return false;
        return isTypeOneOf(node.getType(), types);
    }

    public static TSNode getFirstChildOfTypes(TSNode parent, String... types) {
        if (isAbsent(parent)) return null;
        for (int i = 0; i < parent.getNamedChildCount(); i++) {
            TSNode child = parent.getNamedChild(i);
            if (!isAbsent(child) && isTypeOneOf(child.getType(), types)) {
                return child;
            }
        }
        return null;
    }

    public static TSNode findFirstDescendant(TSNode root, String nodeType) {
        return findFirstDescendantOfTypes(root, nodeType);
    }

    public static TSNode findFirstDescendantOfTypes(TSNode root, String... nodeTypes) {
        if (isAbsent(root)) return null;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (isTypeOneOf(node.getType(), nodeTypes)) {
                return node;
            }
            for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getNamedChild(i);
                if (!isAbsent(child)) {
                    stack.push(child);
                }
            }
        }
        return null;
    }

    /**
     * Checks for an anonymous token child such as the {@code ?} optional marker of a property signature.
     */
    public static boolean hasTokenChild(TSNode parent, String token) {
        if (isAbsent(parent)) return false;
        for (int i = 0; i < parent.getChildCount(); i++) {
            TSNode child = parent.getChild(i);
            if (!isAbsent(child) && token.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsErrors(TSNode node) {
        if (isAbsent(node)) return false;
        return "ERROR".equals(node.getType()) || findFirstDescendant(node, "ERROR") != null;
    }

    public static String unquote(String text) {
        if (text == null || text.length() < 2) return text;
        char first = text.charAt(0);
        char last = text.charAt(text.length() - 1);
        if ((first == '\'' || first == '"' || first == '`') && first == last) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
