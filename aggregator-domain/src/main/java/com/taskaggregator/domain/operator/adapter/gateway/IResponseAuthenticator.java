package com.taskaggregator.domain.operator.adapter.gateway;

/**
 * 响应签名校验端口。
 */
public interface IResponseAuthenticator {

    /**
     * 校验签名是否由 Operator 注册密钥对规范消息 {task, response} 签发。
     *
     * @param taskId     任务 ID
     * @param response   响应内容
     * @param operatorId Operator ID
     * @param signature  签名
     * @return true 签名有效；签名格式错误或不匹配均返回 false
     */
    boolean verify(Long taskId, String response, Long operatorId, String signature);
}
