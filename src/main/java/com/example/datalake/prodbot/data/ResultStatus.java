package com.example.datalake.prodbot.data;

public enum ResultStatus {
  SUCCESS,
  NOT_FOUND,
  FAILURE
}
