package com.raditha.leakage.model;

/**
 * Tree root. Does not represent anything in a particular trace; its ID set is
 * the set of all merged testcases.
 */
public final class RootNode extends SplitNode {
}
