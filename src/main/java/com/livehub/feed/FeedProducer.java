package com.livehub.feed;

/**
 * A collaborator that owns a hub inlet and pushes elements into it.
 */
public interface FeedProducer {

	String name();

	void start();

	void stop();
}
