package com.tandem.client.tree;

@FunctionalInterface
public interface TreeChangeListener {

    void onChanges(ChangeBatch batch);
}
