/**
 * 平台级传输对象。各游戏的广播都包在 {@link com.supplyhub.gameservice.platform.transport.Envelope} 中发出，
 * 前端按 kind 区分完整状态、增量事件与错误。
 */
package com.supplyhub.gameservice.platform.transport;
