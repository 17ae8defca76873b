package xyz.vvrf.flowgraph.core;

/**
 * 在结束循环或结束组装时，仍有分支或循环没有关闭。
 */
public class UnclosedConstructException extends FlowGraphException {

    public UnclosedConstructException(String message) {
        super(message);
    }
}
