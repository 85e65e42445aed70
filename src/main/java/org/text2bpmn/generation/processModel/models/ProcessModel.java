package org.text2bpmn.generation.processModel.models;

public record ProcessModel(
        String id,
        String name,
        Pool pool
) {}
