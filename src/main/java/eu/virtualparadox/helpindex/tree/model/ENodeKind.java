package eu.virtualparadox.helpindex.tree.model;

public enum ENodeKind {
    SECTION,
    PAGE
}
