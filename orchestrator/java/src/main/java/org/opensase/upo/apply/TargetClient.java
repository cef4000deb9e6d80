package org.opensase.upo.apply;

import org.opensase.upo.adapter.NativeObject;
import org.opensase.upo.adapter.TargetKind;

import java.util.List;

/**
 * Connection to one live target. Each call is a single remote mutation or read;
 * implementations do not retry.
 */
public interface TargetClient {

    TargetKind target();

    /** Every object currently on the target, managed or not. */
    List<NativeObject> readState() throws TargetException;

    void add(NativeObject object) throws TargetException;

    void modify(NativeObject object) throws TargetException;

    void remove(NativeObject object) throws TargetException;
}
