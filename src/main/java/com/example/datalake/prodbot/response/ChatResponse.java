package com.example.datalake.prodbot.response;

import com.example.datalake.prodbot.model.EngineResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

  private String sessionId;
  private EngineResponse response;

  public static ChatResponse of(String sessionId, EngineResponse response) {
    return ChatResponse.builder().sessionId(sessionId).response(response).build();
  }
}
