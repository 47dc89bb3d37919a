package com.example.scheduler.model;

import java.util.Objects;

public record RepositoryRef(String organization, String repository) {

  public RepositoryRef {
    Objects.requireNonNull(organization, "organization");
    Objects.requireNonNull(repository, "repository");
  }

  public String fullName() {
    return organization + "/" + repository;
  }
}
