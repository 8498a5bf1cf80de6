package com.netmotif.dsl;

import com.netmotif.motif.MotifKind;

import java.util.HashMap;
import java.util.Map;

public enum TokenType {
    IDENT,
    INT,

    // Keywords
    LET("let"),
    RING("Ring"),
    STAR("Star"),
    GRID("Grid"),
    TREE("Tree"),
    TWO_RINGS_BRIDGE("TwoRingsBridge"),
    PATH("Path"),
    MESH("Mesh"),
    CONNECT("Connect"),
    OVERLAY("Overlay"),
    RELABEL("Relabel"),
    PICK("Pick"),

    // Punctuation
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    COMMA(","),
    COLON(":"),
    DOT("."),
    EQUAL("="),
    LESS("<"),
    GREATER(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),

    EOF;

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType t : values()) {
            if (t.text != null && Character.isLetter(t.text.charAt(0)))
                KEYWORDS.put(t.text, t);
        }
    }

    private final String text;

    TokenType() {
        this(null);
    }

    TokenType(String text) {
        this.text = text;
    }

    /** Fixed source text of this token kind, or null for identifiers, literals and EOF. */
    public String text() {
        return text;
    }

    /** Keyword token type for {@code word}, or {@link #IDENT} if it is not reserved. */
    public static TokenType forWord(String word) {
        return KEYWORDS.getOrDefault(word, IDENT);
    }

    public boolean isMotif() {
        return motifKind() != null;
    }

    /** The motif family this keyword introduces, or null. */
    public MotifKind motifKind() {
        return switch (this) {
            case RING -> MotifKind.RING;
            case STAR -> MotifKind.STAR;
            case GRID -> MotifKind.GRID;
            case TREE -> MotifKind.TREE;
            case TWO_RINGS_BRIDGE -> MotifKind.TWO_RINGS_BRIDGE;
            case PATH -> MotifKind.PATH;
            case MESH -> MotifKind.MESH;
            default -> null;
        };
    }

    public boolean isComparator() {
        return this == EQUAL || this == LESS || this == GREATER || this == LESS_EQUAL || this == GREATER_EQUAL;
    }

    /** Human-readable form for error messages, e.g. {@code ')'} or {@code IDENT}. */
    public String describe() {
        return text != null ? "'" + text + "'" : name();
    }
}
