package io.github.hide212131.langchain4j.incident.runtime.adapter;

@FunctionalInterface
public interface AdapterCall<T> {

    T call() throws AdapterException;
}
