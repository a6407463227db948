package org.yadacoin.network.message;

import java.nio.ByteBuffer;

@FunctionalInterface
public interface MessageProducer {
	Message fromByteBuffer(ByteBuffer byteBuffer) throws MessageException;
}
