package com.raditha.treediff.analyzer;

import com.raditha.treediff.model.Term;

import java.util.concurrent.Callable;

/**
 * One pair of trees to compare in a batch. The trees are produced on the
 * worker thread, so parsing runs in parallel too.
 *
 * @param name    label used in results and log messages, usually the file path
 * @param oldTree produces the tree before the change
 * @param newTree produces the tree after the change
 */
public record DiffJob(String name, Callable<Term> oldTree, Callable<Term> newTree) {
}
