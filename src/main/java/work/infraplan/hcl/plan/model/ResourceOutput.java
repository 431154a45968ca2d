package work.infraplan.hcl.plan.model;

public record ResourceOutput(ResourceJson planned, ResourceChange change, ResourceData configuration) {}
