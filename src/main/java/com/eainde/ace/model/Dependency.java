package com.eainde.ace.model;

import java.io.Serializable;

/**
 * Something an action relies on, e.g. a service being up or a prior step having run.
 */
public record Dependency(String name, boolean met) implements Serializable {
}
