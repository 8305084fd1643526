package cn.bitsleep.taskrush.auth;

public class InvalidCredentialsException extends RuntimeException {
    public InvalidCredentialsException() {
        super("Invalid password");
    }
}
