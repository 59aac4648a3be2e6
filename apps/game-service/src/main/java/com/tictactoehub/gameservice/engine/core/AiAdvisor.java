package com.tictactoehub.gameservice.engine.core;

/**
 * AI 顾问：给定状态，返回一条建议指令（如“在 (1,1) 落子”）。
 * 泛型 S、C 使其不依赖具体游戏。
 */
public interface AiAdvisor<S extends GameState, C> {

    /** 为当前状态给出建议，不修改状态 */
    C suggest(S state);
}
