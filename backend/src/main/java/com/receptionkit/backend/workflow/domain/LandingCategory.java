package com.receptionkit.backend.workflow.domain;

public enum LandingCategory {
  PRIMARY,
  SECONDARY,
  ADMIN
}
