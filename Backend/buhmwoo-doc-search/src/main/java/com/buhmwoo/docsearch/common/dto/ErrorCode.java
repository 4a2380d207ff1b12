package com.buhmwoo.docsearch.common.dto;

public enum ErrorCode {
  VALIDATION_ERROR("E400"),
  BAD_REQUEST("E400"),
  INTERNAL_ERROR("E500");

  private final String code;
  ErrorCode(String code) { this.code = code; }
  public String getCode() { return code; }
}
